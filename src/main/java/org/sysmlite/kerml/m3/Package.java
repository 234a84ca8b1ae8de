package org.sysmlite.kerml.m3;

public class Package extends Namespace {

    private boolean library;
    private boolean standard;

    public Package(ElementKind kind, ModelDocument document) {
        super(kind, document);
    }

    public boolean isLibrary() {
        return library || isKind(ElementKind.LIBRARY_PACKAGE);
    }

    public void setLibrary(boolean library) {
        this.library = library;
    }

    public boolean isStandard() {
        return standard;
    }

    public void setStandard(boolean standard) {
        this.standard = standard;
    }
}
