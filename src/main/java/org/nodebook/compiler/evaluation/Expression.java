package org.nodebook.compiler.evaluation;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Arithmetic expression tree of a function definition. Variables are normalized
 * attribute names.
 */
public sealed interface Expression {

    /**
     * Evaluates the expression.
     *
     * @param variables Values of the referenced attributes, keyed by normalized name.
     * @return The result, possibly non-finite.
     * @throws ExpressionException if a variable has no value.
     */
    double evaluate(Map<String, Double> variables);

    /**
     * @return The normalized names of all referenced attributes, in order of first use.
     */
    default Set<String> variables() {
        Set<String> names = new LinkedHashSet<>();
        collectVariables(names);
        return names;
    }

    void collectVariables(Set<String> names);

    record Constant(double value) implements Expression {
        @Override
        public double evaluate(Map<String, Double> variables) {
            return value;
        }

        @Override
        public void collectVariables(Set<String> names) {
        }
    }

    record Variable(String name) implements Expression {
        @Override
        public double evaluate(Map<String, Double> variables) {
            Double value = variables.get(name);
            if (value == null) {
                throw new ExpressionException("No value for '" + name + "'");
            }
            return value;
        }

        @Override
        public void collectVariables(Set<String> names) {
            names.add(name);
        }
    }

    record Negate(Expression operand) implements Expression {
        @Override
        public double evaluate(Map<String, Double> variables) {
            return -operand.evaluate(variables);
        }

        @Override
        public void collectVariables(Set<String> names) {
            operand.collectVariables(names);
        }
    }

    record Binary(char operator, Expression left, Expression right) implements Expression {
        @Override
        public double evaluate(Map<String, Double> variables) {
            double l = left.evaluate(variables);
            double r = right.evaluate(variables);
            return switch (operator) {
                case '+' -> l + r;
                case '-' -> l - r;
                case '*' -> l * r;
                case '/' -> l / r;
                case '%' -> l % r;
                case '^' -> Math.pow(l, r);
                default -> throw new ExpressionException("Unknown operator '" + operator + "'");
            };
        }

        @Override
        public void collectVariables(Set<String> names) {
            left.collectVariables(names);
            right.collectVariables(names);
        }
    }

    record Call(String function, List<Expression> arguments) implements Expression {

        public Call {
            arguments = List.copyOf(arguments);
        }

        @Override
        public double evaluate(Map<String, Double> variables) {
            double[] args = new double[arguments.size()];
            for (int i = 0; i < args.length; i++) {
                args[i] = arguments.get(i).evaluate(variables);
            }
            return switch (function) {
                case "abs" -> Math.abs(args[0]);
                case "sqrt" -> Math.sqrt(args[0]);
                case "floor" -> Math.floor(args[0]);
                case "ceil" -> Math.ceil(args[0]);
                case "pow" -> Math.pow(args[0], args[1]);
                case "round" -> {
                    if (args.length == 1) yield Math.round(args[0]);
                    double scale = Math.pow(10, args[1]);
                    yield Math.round(args[0] * scale) / scale;
                }
                case "min" -> {
                    double min = args[0];
                    for (double a : args) min = Math.min(min, a);
                    yield min;
                }
                case "max" -> {
                    double max = args[0];
                    for (double a : args) max = Math.max(max, a);
                    yield max;
                }
                default -> throw new ExpressionException("Unknown function '" + function + "'");
            };
        }

        @Override
        public void collectVariables(Set<String> names) {
            arguments.forEach(a -> a.collectVariables(names));
        }
    }
}
