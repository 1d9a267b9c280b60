package org.circomscan.structure.ir;

import org.circomscan.structure.ast.InfixOperator;
import org.circomscan.structure.ast.PrefixOperator;
import org.circomscan.structure.file.Meta;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/*
Expressions of the intermediate representation. Immutable; renaming produces a new expression.
 */
public interface IrExpression {

    Meta meta();

    /*
    every variable name read by this expression, in evaluation order
     */
    void collectReads(Collection<VariableName> reads);

    IrExpression renameReads(UnaryOperator<VariableName> renamer);

    static List<IrExpression> renameAll(List<IrExpression> expressions, UnaryOperator<VariableName> renamer) {
        return expressions.stream().map(e -> e.renameReads(renamer)).toList();
    }

    static String accessToString(List<IrExpression> access) {
        return access.stream().map(e -> "[" + e + "]").collect(Collectors.joining());
    }

    record Number(Meta meta, BigInteger value) implements IrExpression {
        @Override
        public void collectReads(Collection<VariableName> reads) {
            // no variables
        }

        @Override
        public IrExpression renameReads(UnaryOperator<VariableName> renamer) {
            return this;
        }

        @Override
        public String toString() {
            return value.toString();
        }
    }

    record Variable(Meta meta, VariableName name, List<IrExpression> access) implements IrExpression {
        public Variable {
            access = List.copyOf(access);
        }

        @Override
        public void collectReads(Collection<VariableName> reads) {
            reads.add(name);
            access.forEach(e -> e.collectReads(reads));
        }

        @Override
        public IrExpression renameReads(UnaryOperator<VariableName> renamer) {
            List<IrExpression> newAccess = renameAll(access, renamer);
            return new Variable(meta, renamer.apply(name), newAccess);
        }

        @Override
        public String toString() {
            return name + accessToString(access);
        }
    }

    /*
    the value of array 'name' with the element at 'access' replaced by 'value'
     */
    record Update(Meta meta, VariableName name, List<IrExpression> access, IrExpression value)
            implements IrExpression {
        public Update {
            access = List.copyOf(access);
        }

        @Override
        public void collectReads(Collection<VariableName> reads) {
            reads.add(name);
            access.forEach(e -> e.collectReads(reads));
            value.collectReads(reads);
        }

        @Override
        public IrExpression renameReads(UnaryOperator<VariableName> renamer) {
            List<IrExpression> newAccess = renameAll(access, renamer);
            IrExpression newValue = value.renameReads(renamer);
            return new Update(meta, renamer.apply(name), newAccess, newValue);
        }

        @Override
        public String toString() {
            return "update(" + name + accessToString(access) + ", " + value + ")";
        }
    }

    record Infix(Meta meta, IrExpression lhs, InfixOperator operator, IrExpression rhs) implements IrExpression {
        @Override
        public void collectReads(Collection<VariableName> reads) {
            lhs.collectReads(reads);
            rhs.collectReads(reads);
        }

        @Override
        public IrExpression renameReads(UnaryOperator<VariableName> renamer) {
            IrExpression newLhs = lhs.renameReads(renamer);
            return new Infix(meta, newLhs, operator, rhs.renameReads(renamer));
        }

        @Override
        public String toString() {
            return "(" + lhs + " " + operator.symbol() + " " + rhs + ")";
        }
    }

    record Prefix(Meta meta, PrefixOperator operator, IrExpression rhs) implements IrExpression {
        @Override
        public void collectReads(Collection<VariableName> reads) {
            rhs.collectReads(reads);
        }

        @Override
        public IrExpression renameReads(UnaryOperator<VariableName> renamer) {
            return new Prefix(meta, operator, rhs.renameReads(renamer));
        }

        @Override
        public String toString() {
            return operator.symbol() + rhs;
        }
    }

    record Call(Meta meta, String name, List<IrExpression> arguments) implements IrExpression {
        public Call {
            arguments = List.copyOf(arguments);
        }

        @Override
        public void collectReads(Collection<VariableName> reads) {
            arguments.forEach(e -> e.collectReads(reads));
        }

        @Override
        public IrExpression renameReads(UnaryOperator<VariableName> renamer) {
            return new Call(meta, name, renameAll(arguments, renamer));
        }

        @Override
        public String toString() {
            return name + arguments.stream().map(Object::toString).collect(Collectors.joining(", ", "(", ")"));
        }
    }

    /*
    one argument per predecessor of the block containing the phi, in predecessor order.
    The arguments are filled in during renaming, not by renameReads.
     */
    record Phi(Meta meta, List<VariableName> arguments) implements IrExpression {
        public Phi {
            arguments = List.copyOf(arguments);
        }

        public Phi withArgument(int index, VariableName argument) {
            List<VariableName> newArguments = new ArrayList<>(arguments);
            newArguments.set(index, argument);
            return new Phi(meta, newArguments);
        }

        @Override
        public void collectReads(Collection<VariableName> reads) {
            reads.addAll(arguments);
        }

        @Override
        public IrExpression renameReads(UnaryOperator<VariableName> renamer) {
            return this;
        }

        @Override
        public String toString() {
            return "phi" + arguments.stream().map(Object::toString).collect(Collectors.joining(", ", "(", ")"));
        }
    }
}
