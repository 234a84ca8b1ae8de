package org.sysmlite.kerml.m3;

/**
 * A type-to-type relationship: specialization and its subkinds,
 * conjugation, disjoining, featuring, inverting and chaining.
 */
public class Specialization extends Relationship {

    public Specialization(RelationshipKind kind, ModelDocument document, boolean implied) {
        super(ElementKind.SPECIALIZATION, kind, document, implied);
    }

    /**
     * Creates an implied relationship from {@code specific} to {@code general}.
     */
    public static Specialization implied(RelationshipKind kind, Type specific, Type general) {
        Specialization specialization = new Specialization(kind, specific.document(), true);
        specialization.setSource(specific);
        specialization.setTargetReference(ElementReference.to(general));
        return specialization;
    }

    public Type specific() {
        return source() instanceof Type type ? type : null;
    }

    public Type general() {
        return target() instanceof Type type ? type : null;
    }

    @Override
    public String effectiveName() {
        return name();
    }
}
