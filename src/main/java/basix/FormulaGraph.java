package basix;

import java.util.ArrayList;
import java.util.List;

import guru.nidi.graphviz.attribute.*;
import guru.nidi.graphviz.model.*;

import static basix.Syntax.*;
import static guru.nidi.graphviz.model.Factory.*;

/**
 * Graphviz graphs of formula trees, for debugging the transformations.
 * Subtrees that occur more than once in a formula are drawn once per occurrence.
 */
public class FormulaGraph {

    private FormulaGraph() {
    }

    public static MutableGraph create(Formula formula) {
        return create("formula", formula);
    }

    public static MutableGraph create(String name, Formula formula) {
        List<MutableNode> nodeList = new ArrayList<>();
        addNodes(formula, nodeList);
        MutableGraph graph = mutGraph(name).setDirected(true);
        graph.nodeAttrs().add(Font.name("Helvetica"));
        graph.add(nodeList.toArray(new MutableNode[0]));
        return graph;
    }

    /**
     * Graph in the dot format
     */
    public static String toDot(Formula formula) {
        return create(formula).toString();
    }

    private static MutableNode addNodes(Formula formula, List<MutableNode> nodeList) {
        MutableNode node = mutNode("n" + nodeList.size());
        node.add(Label.of(formula.root()));
        nodeList.add(node);
        formula.accept(new FormulaVisitor<Void>() {
            @Override
            public Void visit(VariableNode variable) {
                node.add(Color.BLUE, Color.BLUE.font());
                return null;
            }

            @Override
            public Void visit(ConstantNode constant) {
                node.add(Color.RED, Color.RED.font());
                return null;
            }

            @Override
            public Void visit(UnaryOperatorNode unaryOperator) {
                node.addLink(addNodes(unaryOperator.first, nodeList));
                return null;
            }

            @Override
            public Void visit(BinaryOperatorNode binaryOperator) {
                node.addLink(addNodes(binaryOperator.first, nodeList));
                node.addLink(addNodes(binaryOperator.second, nodeList));
                return null;
            }
        });
        return node;
    }
}
