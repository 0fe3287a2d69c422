package com.nevis.hybrid.model;

/**
 * A stored document together with its insertion sequence and the score a backend ranked it by.
 * The sequence breaks score ties so equal scores keep insertion order.
 */
public record ScoredDocument(Document document, long sequence, double score) {

    public String id() {
        return document.id();
    }
}
