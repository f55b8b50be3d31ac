package com.eainde.loganalyzer.parse;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ExceptionExtractorTest {

    private final ExceptionExtractor extractor = new ExceptionExtractor();

    @Test
    void findsSimpleTypeName() {
        assertThat(extractor.extract("NullPointerException at Foo.java:42"))
                .containsExactly("NullPointerException");
    }

    @Test
    void dropsPackageQualifierAndKeepsMarkerText() {
        assertThat(extractor.extract("Caused by: java.io.IOException: Broken pipe"))
                .containsExactly("IOException", "java io ioexception broken pipe");
    }

    @Test
    void markerTextWithVariableDataYieldsOneToken() {
        assertThat(extractor.extract("Request failed, Exception: user 17 not found"))
                .containsExactly("user <num> not found");
        assertThat(extractor.extract("Request failed, Exception: user 20000 not found"))
                .containsExactly("user <num> not found");
    }

    @Test
    void punctuationOnlyMarkerTextIsDropped() {
        assertThat(extractor.extract("Exception: ---")).isEmpty();
    }

    @Test
    void recognisesErrorAndFaultSuffixes() {
        assertThat(extractor.extract("OutOfMemoryError while handling SoapFault"))
                .containsExactly("OutOfMemoryError", "SoapFault");
    }

    @Test
    void ignoresLowerCaseWords() {
        assertThat(extractor.extract("connection error, retrying")).isEmpty();
    }

    @Test
    void cutsLongMarkerText() {
        String tail = "x".repeat(300);

        assertThat(extractor.extract("Exception: " + tail))
                .singleElement()
                .satisfies(token -> assertThat(token).hasSize(ExceptionExtractor.MAX_MARKER_TEXT));
    }

    @Test
    void emptyForBlankInput() {
        assertThat(extractor.extract("")).isEmpty();
        assertThat(extractor.extract(null)).isEmpty();
    }
}
