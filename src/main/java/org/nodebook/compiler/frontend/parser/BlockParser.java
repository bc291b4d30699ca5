package org.nodebook.compiler.frontend.parser;

import org.nodebook.compiler.diagnostics.DiagnosticsEngine;
import org.nodebook.compiler.diagnostics.ErrorKind;
import org.nodebook.compiler.frontend.lexer.ClassifiedLine;
import org.nodebook.compiler.frontend.lexer.LineKind;
import org.nodebook.compiler.frontend.parser.ast.AstNode;
import org.nodebook.compiler.frontend.parser.ast.AttributeDecl;
import org.nodebook.compiler.frontend.parser.ast.CnlDocument;
import org.nodebook.compiler.frontend.parser.ast.MorphDecl;
import org.nodebook.compiler.frontend.parser.ast.NodeDecl;
import org.nodebook.compiler.frontend.parser.ast.RelationDecl;
import org.nodebook.graph.Identifiers;
import org.nodebook.graph.Morph;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the parse tree from the classified line stream.
 * <p>
 * The parser tracks the current node and the current morph. A node heading opens a
 * new {@link NodeDecl} whose current morph is the default morph; a morph heading
 * switches the current morph of that node. Relation and attribute lines attach to
 * the current morph. Description fences attach to the current named morph if there
 * is one, otherwise to the node.
 */
public class BlockParser {

    private final DiagnosticsEngine diagnostics;

    private final List<NodeDecl> nodes = new ArrayList<>();
    private final List<String> graphDescriptions = new ArrayList<>();
    private NodeBuilder currentNode;
    private MorphBuilder currentMorph;

    public BlockParser(DiagnosticsEngine diagnostics) {
        this.diagnostics = diagnostics;
    }

    /**
     * Parses the classified lines of one document.
     *
     * @param lines The output of the line classifier.
     * @return The parse tree.
     */
    public CnlDocument parse(List<ClassifiedLine> lines) {
        int i = 0;
        while (i < lines.size()) {
            ClassifiedLine line = lines.get(i);
            switch (line.kind()) {
                case NODE_HEADING -> startNode(line);
                case MORPH_HEADING -> startMorph(line);
                case RELATION -> attach(line, new RelationDecl(line.lineNumber(), line.name(), line.value(),
                        line.modifiers().emphasis(), line.modifiers().modality()));
                case ATTRIBUTE -> attach(line, new AttributeDecl(line.lineNumber(), line.name(), line.value(),
                        line.modifiers().unit(), line.modifiers().modality(), line.modifiers().quantifier(),
                        line.modifiers().emphasis()));
                case DESCRIPTION_OPEN, GRAPH_DESCRIPTION_OPEN -> i = captureFence(lines, i);
                case INVALID -> {
                    if (currentMorph != null) {
                        currentMorph.invalidLines.add(line.lineNumber());
                    }
                }
                case BLANK, VERBATIM, FENCE_CLOSE -> {
                    // nothing to build
                }
            }
            i++;
        }
        finishNode();
        String graphDescription = graphDescriptions.isEmpty() ? null : String.join("\n\n", graphDescriptions);
        return new CnlDocument(nodes, graphDescription);
    }

    private void startNode(ClassifiedLine line) {
        finishNode();
        currentNode = new NodeBuilder(line);
        currentMorph = currentNode.morph(Morph.DEFAULT_NAME, line.lineNumber(), true);
    }

    private void startMorph(ClassifiedLine line) {
        if (currentNode == null) {
            diagnostics.reportError(ErrorKind.STRUCTURAL,
                    "Morph '" + line.name() + "' declared before any node", line.lineNumber());
            return;
        }
        currentMorph = currentNode.morph(line.name(), line.lineNumber(), false);
    }

    private void attach(ClassifiedLine line, AstNode statement) {
        if (currentNode == null) {
            String what = line.kind() == LineKind.RELATION ? "Relation" : "Attribute";
            diagnostics.reportError(ErrorKind.STRUCTURAL,
                    what + " '" + line.name() + "' declared before any node", line.lineNumber());
            return;
        }
        currentMorph.statements.add(statement);
    }

    /**
     * Consumes a fenced block starting at {@code start}.
     *
     * @return Index of the closing fence, or of the last line if the fence is never closed.
     */
    private int captureFence(List<ClassifiedLine> lines, int start) {
        ClassifiedLine open = lines.get(start);
        List<String> text = new ArrayList<>();
        int i = start + 1;
        while (i < lines.size() && lines.get(i).kind() == LineKind.VERBATIM) {
            text.add(lines.get(i).raw());
            i++;
        }
        if (i >= lines.size() || lines.get(i).kind() != LineKind.FENCE_CLOSE) {
            // unclosed, already reported by the classifier
            return lines.size() - 1;
        }

        String content = String.join("\n", text).strip();
        if (open.kind() == LineKind.GRAPH_DESCRIPTION_OPEN) {
            graphDescriptions.add(content);
        } else if (currentNode == null) {
            diagnostics.reportError(ErrorKind.STRUCTURAL, "Description declared before any node", open.lineNumber());
        } else if (!currentMorph.defaultMorph) {
            currentMorph.description = append(currentMorph.description, content);
        } else {
            currentNode.description = append(currentNode.description, content);
        }
        return i;
    }

    private static String append(String existing, String content) {
        return existing.isEmpty() ? content : existing + "\n" + content;
    }

    private void finishNode() {
        if (currentNode != null) {
            nodes.add(currentNode.build());
        }
        currentNode = null;
        currentMorph = null;
    }

    private static final class NodeBuilder {
        private final ClassifiedLine heading;
        private final Map<String, MorphBuilder> morphs = new LinkedHashMap<>();
        private String description = "";

        NodeBuilder(ClassifiedLine heading) {
            this.heading = heading;
        }

        MorphBuilder morph(String name, int line, boolean defaultMorph) {
            return morphs.computeIfAbsent(Identifiers.normalize(name), k -> new MorphBuilder(name, line, defaultMorph));
        }

        NodeDecl build() {
            List<MorphDecl> built = new ArrayList<>();
            for (MorphBuilder morph : morphs.values()) {
                built.add(new MorphDecl(morph.line, morph.name, morph.defaultMorph, morph.description,
                        morph.statements, morph.invalidLines));
            }
            return new NodeDecl(heading.lineNumber(), heading.name(), heading.declaredTypes(),
                    heading.modifiers().emphasis(), heading.modifiers().quantifier(), description, built);
        }
    }

    private static final class MorphBuilder {
        private final String name;
        private final int line;
        private final boolean defaultMorph;
        private final List<AstNode> statements = new ArrayList<>();
        private final List<Integer> invalidLines = new ArrayList<>();
        private String description = "";

        MorphBuilder(String name, int line, boolean defaultMorph) {
            this.name = name;
            this.line = line;
            this.defaultMorph = defaultMorph;
        }
    }
}
