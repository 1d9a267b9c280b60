package org.circomscan.structure.ir;

import org.circomscan.structure.ast.AssignOperator;
import org.circomscan.structure.ast.VariableType;
import org.circomscan.structure.file.Meta;

import java.util.Collection;
import java.util.List;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

import static org.circomscan.structure.ir.IrExpression.accessToString;
import static org.circomscan.structure.ir.IrExpression.renameAll;

/*
Statements of the intermediate representation. Immutable; renaming produces a new statement.
A block ends with at most one control statement (IfThenElse, Return); the branch targets are the
successors of the block.
 */
public interface IrStatement {

    Meta meta();

    void collectReads(Collection<VariableName> reads);

    IrStatement renameReads(UnaryOperator<VariableName> renamer);

    /*
    the variable (re)defined by this statement, or null
     */
    default VariableName definesOrNull() {
        return null;
    }

    /*
    replaces the variable defined by this statement; only valid when definesOrNull() is not null
     */
    default IrStatement withDefinition(VariableName newVariable) {
        throw new UnsupportedOperationException("Statement defines no variable: " + this);
    }

    record Declaration(Meta meta, VariableName name, VariableType type, List<IrExpression> dimensions)
            implements IrStatement {
        public Declaration {
            dimensions = List.copyOf(dimensions);
        }

        // declaring a local variable gives it a (default) value
        @Override
        public VariableName definesOrNull() {
            return type.isLocal() ? name : null;
        }

        @Override
        public IrStatement withDefinition(VariableName newVariable) {
            return new Declaration(meta, newVariable, type, dimensions);
        }

        @Override
        public void collectReads(Collection<VariableName> reads) {
            dimensions.forEach(e -> e.collectReads(reads));
        }

        @Override
        public IrStatement renameReads(UnaryOperator<VariableName> renamer) {
            return new Declaration(meta, name, type, renameAll(dimensions, renamer));
        }

        @Override
        public String toString() {
            return type.keyword() + " " + name + accessToString(dimensions);
        }
    }

    record Substitution(Meta meta, VariableName variable, List<IrExpression> access, AssignOperator operator,
                        IrExpression rhs) implements IrStatement {
        public Substitution {
            access = List.copyOf(access);
        }

        @Override
        public Substitution withDefinition(VariableName newVariable) {
            return new Substitution(meta, newVariable, access, operator, rhs);
        }

        public Substitution withRhs(IrExpression newRhs) {
            return new Substitution(meta, variable, access, operator, newRhs);
        }

        public boolean isPhi() {
            return rhs instanceof IrExpression.Phi;
        }

        @Override
        public VariableName definesOrNull() {
            return variable;
        }

        @Override
        public void collectReads(Collection<VariableName> reads) {
            access.forEach(e -> e.collectReads(reads));
            rhs.collectReads(reads);
        }

        @Override
        public IrStatement renameReads(UnaryOperator<VariableName> renamer) {
            return new Substitution(meta, variable, renameAll(access, renamer), operator, rhs.renameReads(renamer));
        }

        @Override
        public String toString() {
            return variable + accessToString(access) + " " + operator.symbol() + " " + rhs;
        }
    }

    record ConstraintEquality(Meta meta, IrExpression lhs, IrExpression rhs) implements IrStatement {
        @Override
        public void collectReads(Collection<VariableName> reads) {
            lhs.collectReads(reads);
            rhs.collectReads(reads);
        }

        @Override
        public IrStatement renameReads(UnaryOperator<VariableName> renamer) {
            IrExpression newLhs = lhs.renameReads(renamer);
            return new ConstraintEquality(meta, newLhs, rhs.renameReads(renamer));
        }

        @Override
        public String toString() {
            return lhs + " === " + rhs;
        }
    }

    record IfThenElse(Meta meta, IrExpression condition) implements IrStatement {
        @Override
        public void collectReads(Collection<VariableName> reads) {
            condition.collectReads(reads);
        }

        @Override
        public IrStatement renameReads(UnaryOperator<VariableName> renamer) {
            return new IfThenElse(meta, condition.renameReads(renamer));
        }

        @Override
        public String toString() {
            return "if " + condition;
        }
    }

    record Return(Meta meta, IrExpression value) implements IrStatement {
        @Override
        public void collectReads(Collection<VariableName> reads) {
            value.collectReads(reads);
        }

        @Override
        public IrStatement renameReads(UnaryOperator<VariableName> renamer) {
            return new Return(meta, value.renameReads(renamer));
        }

        @Override
        public String toString() {
            return "return " + value;
        }
    }

    record Assert(Meta meta, IrExpression condition) implements IrStatement {
        @Override
        public void collectReads(Collection<VariableName> reads) {
            condition.collectReads(reads);
        }

        @Override
        public IrStatement renameReads(UnaryOperator<VariableName> renamer) {
            return new Assert(meta, condition.renameReads(renamer));
        }

        @Override
        public String toString() {
            return "assert(" + condition + ")";
        }
    }

    record LogCall(Meta meta, List<IrExpression> arguments) implements IrStatement {
        public LogCall {
            arguments = List.copyOf(arguments);
        }

        @Override
        public void collectReads(Collection<VariableName> reads) {
            arguments.forEach(e -> e.collectReads(reads));
        }

        @Override
        public IrStatement renameReads(UnaryOperator<VariableName> renamer) {
            return new LogCall(meta, renameAll(arguments, renamer));
        }

        @Override
        public String toString() {
            return "log" + arguments.stream().map(Object::toString).collect(Collectors.joining(", ", "(", ")"));
        }
    }
}
