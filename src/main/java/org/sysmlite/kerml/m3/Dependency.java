package org.sysmlite.kerml.m3;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class Dependency extends Relationship {

    private final List<ElementReference> clients = new ArrayList<>();
    private final List<ElementReference> suppliers = new ArrayList<>();

    public Dependency(ModelDocument document) {
        super(ElementKind.DEPENDENCY, RelationshipKind.DEPENDENCY, document, false);
    }

    public List<ElementReference> clients() {
        return Collections.unmodifiableList(clients);
    }

    public List<ElementReference> suppliers() {
        return Collections.unmodifiableList(suppliers);
    }

    public void addClient(ElementReference reference) {
        clients.add(reference);
    }

    public void addSupplier(ElementReference reference) {
        suppliers.add(reference);
    }

    @Override
    public List<ElementReference> references() {
        List<ElementReference> result = new ArrayList<>(clients);
        result.addAll(suppliers);
        return result;
    }
}
