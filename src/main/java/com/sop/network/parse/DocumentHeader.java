package com.sop.network.parse;

/**
 * Header fields of a procedure document. Missing fields are empty strings.
 */
public record DocumentHeader(String title, String documentType, String documentNumber,
                             String status, String causeExplanation, String pendCode) {

    public DocumentHeader {
        title = orEmpty(title);
        documentType = orEmpty(documentType);
        documentNumber = orEmpty(documentNumber);
        status = orEmpty(status);
        causeExplanation = orEmpty(causeExplanation);
        pendCode = orEmpty(pendCode);
    }

    public static DocumentHeader empty() {
        return new DocumentHeader("", "", "", "", "", "");
    }

    private static String orEmpty(String value) {
        return value != null ? value : "";
    }
}
