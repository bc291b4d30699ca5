package org.nodebook.compiler.frontend.semantics;

import org.nodebook.graph.Attribute;
import org.nodebook.graph.Identifiers;
import org.nodebook.graph.Morph;
import org.nodebook.graph.Relation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The relations and attributes a submission declares in one morph of a node.
 */
public final class ResolvedMorph {

    private Morph morph;
    private final boolean touched;
    private final int line;
    private final List<Relation> relations = new ArrayList<>();
    private final List<Attribute> attributes = new ArrayList<>();
    private final Map<String, TypedValue> values = new LinkedHashMap<>();

    ResolvedMorph(Morph morph, boolean touched, int line) {
        this.morph = morph;
        this.touched = touched;
        this.line = line;
    }

    public Morph morph() {
        return morph;
    }

    public void updateMorph(Morph morph) {
        this.morph = morph;
    }

    /**
     * @return true if the submission declares this morph, which makes its stored
     * contents subject to deletion by omission.
     */
    public boolean touched() {
        return touched;
    }

    public int line() {
        return line;
    }

    public List<Relation> relations() {
        return Collections.unmodifiableList(relations);
    }

    public List<Attribute> attributes() {
        return Collections.unmodifiableList(attributes);
    }

    /**
     * @return Parsed values of the declared attributes, keyed by normalized name.
     * The first declaration of a name wins.
     */
    public Map<String, TypedValue> values() {
        return Collections.unmodifiableMap(values);
    }

    /**
     * Outcome of adding a declaration to the morph.
     */
    public enum AddOutcome {
        ADDED,
        /** Same identity with the same fields; nothing changes. */
        REPEAT,
        /** Same identity with different fields; nothing changes. */
        CONFLICT
    }

    /**
     * Adds a relation. Identity within the morph is the normalized name and the target.
     */
    public AddOutcome addRelation(Relation relation) {
        for (Relation existing : relations) {
            if (existing.targetId().equals(relation.targetId())
                    && Identifiers.normalize(existing.name()).equals(Identifiers.normalize(relation.name()))) {
                boolean same = Objects.equals(existing.adverb(), relation.adverb())
                        && Objects.equals(existing.modality(), relation.modality());
                return same ? AddOutcome.REPEAT : AddOutcome.CONFLICT;
            }
        }
        relations.add(relation);
        return AddOutcome.ADDED;
    }

    /**
     * Adds an attribute and records its parsed value. Identity within the morph is
     * the normalized name and value.
     */
    public AddOutcome addAttribute(Attribute attribute, TypedValue value) {
        String name = Identifiers.normalize(attribute.name());
        String normalizedValue = Identifiers.normalize(attribute.value());
        for (Attribute existing : attributes) {
            if (Identifiers.normalize(existing.name()).equals(name)
                    && Identifiers.normalize(existing.value()).equals(normalizedValue)) {
                boolean same = Objects.equals(existing.unit(), attribute.unit())
                        && Objects.equals(existing.modality(), attribute.modality())
                        && Objects.equals(existing.quantifier(), attribute.quantifier())
                        && Objects.equals(existing.adverb(), attribute.adverb());
                return same ? AddOutcome.REPEAT : AddOutcome.CONFLICT;
            }
        }
        attributes.add(attribute);
        values.putIfAbsent(name, value);
        return AddOutcome.ADDED;
    }
}
