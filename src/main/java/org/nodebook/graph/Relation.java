package org.nodebook.graph;

/**
 * A directed, named edge between two nodes, owned by one morph of its source.
 *
 * @param id            Stable identifier.
 * @param sourceId      Source node id.
 * @param targetId      Target node id.
 * @param name          Relation type name.
 * @param morphId       Morph of the source node the relation belongs to.
 * @param adverb        Adverb modifier, or null.
 * @param modality      Modality modifier, or null.
 * @param inferred      True for inverses materialized from a symmetric relation.
 * @param originMorphId For inferred relations, the morph of the declaration that produced it; otherwise null.
 */
public record Relation(String id, String sourceId, String targetId, String name, MorphId morphId,
                       String adverb, String modality, boolean inferred, MorphId originMorphId)
        implements GraphEntity {
}
