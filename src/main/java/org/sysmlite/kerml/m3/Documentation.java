package org.sysmlite.kerml.m3;

/**
 * Documentation comment ({@code doc /* ... *}{@code /}), always about its owner.
 */
public class Documentation extends Comment {

    public Documentation(ModelDocument document) {
        super(ElementKind.DOCUMENTATION, document);
    }
}
