package org.circomscan.structure.cfg;

import org.circomscan.structure.ast.*;
import org.circomscan.structure.constants.Curve;
import org.circomscan.structure.definition.Definition;
import org.circomscan.structure.file.Meta;
import org.circomscan.structure.ir.IrExpression;
import org.circomscan.structure.ir.IrStatement;
import org.circomscan.structure.ir.VariableName;
import org.circomscan.structure.report.ReportCollection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.*;

/*
AST -> CFG, not yet in SSA form.

Scopes: the parameters form the outermost scope, every block opens a new one. A declaration that shadows a
visible declaration is reported, and gets a fresh name (x_1, x_2, ...) so that the two variables stay apart.
Statements following a return end up in unreachable blocks, which are removed at the end.
 */
public class CfgBuilder {
    private static final Logger LOGGER = LoggerFactory.getLogger(CfgBuilder.class);

    private record Declared(String uniqueName, VariableType type, Meta meta) {
    }

    private final Definition definition;
    private final BigInteger prime;
    private final ReportCollection reports;

    private final List<BasicBlock> blocks = new ArrayList<>();
    private final Map<String, VariableType> variableTypes = new LinkedHashMap<>();
    private final Set<String> generatedNames = new HashSet<>();
    private final Deque<Map<String, Declared>> scopes = new ArrayDeque<>();
    private BasicBlock current;

    public CfgBuilder(Definition definition, Curve curve, ReportCollection reports) {
        this.definition = definition;
        this.prime = curve.prime();
        this.reports = reports;
    }

    public Cfg build() {
        LOGGER.debug("Building CFG for {} {}", definition.kind().keyword(), definition.name());
        current = newBlock();
        scopes.push(new HashMap<>());
        List<VariableName> parameters = declareParameters();
        lowerInNewScope(definition.body());
        scopes.pop();
        List<BasicBlock> reachable = pruneUnreachable();
        return new Cfg(definition.name(), definition.kind(), definition.meta(), parameters, variableTypes, reachable);
    }

    private List<VariableName> declareParameters() {
        List<VariableName> parameters = new ArrayList<>();
        Map<String, Declared> outer = Objects.requireNonNull(scopes.peek());
        for (String parameter : definition.parameters()) {
            if (outer.containsKey(parameter)) {
                reports.add(new CfgError.ParameterNameCollision(parameter, definition.meta()).toReport());
            } else {
                outer.put(parameter, new Declared(parameter, VariableType.LOCAL, definition.meta()));
                variableTypes.put(parameter, VariableType.LOCAL);
                parameters.add(VariableName.of(parameter));
            }
        }
        return parameters;
    }

    // ---- blocks

    private BasicBlock newBlock() {
        BasicBlock block = new BasicBlock(blocks.size());
        blocks.add(block);
        return block;
    }

    private static void link(BasicBlock from, BasicBlock to) {
        from.addSuccessor(to.index());
        to.addPredecessor(from.index());
    }

    private List<BasicBlock> pruneUnreachable() {
        Set<Integer> reachable = new HashSet<>();
        Deque<Integer> toDo = new ArrayDeque<>();
        toDo.push(0);
        while (!toDo.isEmpty()) {
            int index = toDo.pop();
            if (reachable.add(index)) {
                blocks.get(index).successors().forEach(toDo::push);
            }
        }
        if (reachable.size() == blocks.size()) return blocks;
        Map<Integer, Integer> oldToNew = new HashMap<>();
        List<BasicBlock> result = new ArrayList<>();
        for (BasicBlock block : blocks) {
            if (reachable.contains(block.index())) {
                oldToNew.put(block.index(), result.size());
                result.add(block);
            }
        }
        result.forEach(b -> b.renumber(oldToNew));
        LOGGER.trace("Removed {} unreachable blocks from {}", blocks.size() - result.size(), definition.name());
        return result;
    }

    // ---- scopes

    private String declare(String name, VariableType type, Meta meta) {
        Declared visible = lookupOrNull(name);
        String uniqueName;
        if (visible != null) {
            reports.add(new CfgError.ShadowingVariable(name, meta, visible.meta()).toReport());
            uniqueName = freshName(name);
        } else if (variableTypes.containsKey(name)
                   && (variableTypes.get(name) != type || generatedNames.contains(name))) {
            // same name in a sibling scope with a different type, or clashing with a generated name
            uniqueName = freshName(name);
        } else {
            uniqueName = name;
        }
        Objects.requireNonNull(scopes.peek()).put(name, new Declared(uniqueName, type, meta));
        variableTypes.put(uniqueName, type);
        return uniqueName;
    }

    private String freshName(String name) {
        int i = 1;
        while (variableTypes.containsKey(name + "_" + i)) ++i;
        String fresh = name + "_" + i;
        generatedNames.add(fresh);
        return fresh;
    }

    private Declared lookupOrNull(String name) {
        for (Map<String, Declared> scope : scopes) {
            Declared declared = scope.get(name);
            if (declared != null) return declared;
        }
        return null;
    }

    private Declared lookup(String name, Meta meta) {
        Declared declared = lookupOrNull(name);
        if (declared == null) {
            throw new CfgException(new CfgError.UndefinedVariable(name, meta));
        }
        return declared;
    }

    // ---- statements

    private void lowerInNewScope(Statement statement) {
        scopes.push(new HashMap<>());
        if (statement instanceof Block block) {
            for (Statement s : block.statements()) {
                if (current.isTerminated()) {
                    current = newBlock();
                }
                lowerStatement(s);
            }
        } else {
            lowerStatement(statement);
        }
        scopes.pop();
    }

    private void lowerStatement(Statement statement) {
        if (statement instanceof Block block) {
            lowerInNewScope(block);
        } else if (statement instanceof Declaration d) {
            List<IrExpression> dimensions = lowerAll(d.dimensions());
            String uniqueName = declare(d.name(), d.type(), d.meta());
            current.add(new IrStatement.Declaration(d.meta(), VariableName.of(uniqueName), d.type(), dimensions));
        } else if (statement instanceof Substitution s) {
            lowerSubstitution(s);
        } else if (statement instanceof ConstraintEquality ce) {
            IrExpression lhs = lowerExpression(ce.lhs());
            current.add(new IrStatement.ConstraintEquality(ce.meta(), lhs, lowerExpression(ce.rhs())));
        } else if (statement instanceof IfThenElse ite) {
            lowerIfThenElse(ite);
        } else if (statement instanceof While w) {
            lowerWhile(w);
        } else if (statement instanceof Return r) {
            current.add(new IrStatement.Return(r.meta(), lowerExpression(r.value())));
        } else if (statement instanceof Assert a) {
            current.add(new IrStatement.Assert(a.meta(), lowerExpression(a.condition())));
        } else if (statement instanceof LogCall lc) {
            current.add(new IrStatement.LogCall(lc.meta(), lowerAll(lc.arguments())));
        } else {
            throw new UnsupportedOperationException("Unknown statement " + statement.getClass());
        }
    }

    /*
    x[i] = e on a local variable becomes x = update(x, i, e), so that every write to x defines a new version
     */
    private void lowerSubstitution(Substitution s) {
        IrExpression rhs = lowerExpression(s.rhs());
        Declared target = lookup(s.variable(), s.meta());
        VariableName variable = VariableName.of(target.uniqueName());
        List<IrExpression> access = lowerAll(s.access());
        if (target.type().isLocal() && !access.isEmpty()) {
            rhs = new IrExpression.Update(s.meta(), variable, access, rhs);
            access = List.of();
        }
        current.add(new IrStatement.Substitution(s.meta(), variable, access, s.operator(), rhs));
    }

    private void lowerIfThenElse(IfThenElse ite) {
        IrExpression condition = lowerExpression(ite.condition());
        current.add(new IrStatement.IfThenElse(ite.meta(), condition));
        BasicBlock header = current;

        BasicBlock ifBlock = newBlock();
        link(header, ifBlock);
        current = ifBlock;
        lowerInNewScope(ite.ifCase());
        BasicBlock ifEnd = current;

        BasicBlock elseEnd = null;
        BasicBlock elseBlock = null;
        if (ite.elseCase() != null) {
            elseBlock = newBlock();
            link(header, elseBlock);
            current = elseBlock;
            lowerInNewScope(ite.elseCase());
            elseEnd = current;
        }
        BasicBlock join = newBlock();
        if (elseBlock == null) {
            link(header, join);
        } else if (!elseEnd.isTerminated()) {
            link(elseEnd, join);
        }
        if (!ifEnd.isTerminated()) {
            link(ifEnd, join);
        }
        current = join;
    }

    private void lowerWhile(While w) {
        BasicBlock header = newBlock();
        link(current, header);
        current = header;
        IrExpression condition = lowerExpression(w.condition());
        header.add(new IrStatement.IfThenElse(w.meta(), condition));

        BasicBlock body = newBlock();
        link(header, body);
        current = body;
        lowerInNewScope(w.body());
        if (!current.isTerminated()) {
            link(current, header);
        }
        BasicBlock exit = newBlock();
        link(header, exit);
        current = exit;
    }

    // ---- expressions

    private List<IrExpression> lowerAll(List<Expression> expressions) {
        return expressions.stream().map(this::lowerExpression).toList();
    }

    private IrExpression lowerExpression(Expression expression) {
        if (expression instanceof NumberExpression n) {
            return new IrExpression.Number(n.meta(), n.value().mod(prime));
        }
        if (expression instanceof VariableExpression v) {
            Declared declared = lookup(v.name(), v.meta());
            return new IrExpression.Variable(v.meta(), VariableName.of(declared.uniqueName()), lowerAll(v.access()));
        }
        if (expression instanceof InfixExpression ie) {
            IrExpression lhs = lowerExpression(ie.lhs());
            IrExpression rhs = lowerExpression(ie.rhs());
            if (lhs instanceof IrExpression.Number l && rhs instanceof IrExpression.Number r) {
                BigInteger folded = ie.operator().fold(l.value(), r.value(), prime);
                if (folded != null) return new IrExpression.Number(ie.meta(), folded);
            }
            return new IrExpression.Infix(ie.meta(), lhs, ie.operator(), rhs);
        }
        if (expression instanceof PrefixExpression pe) {
            IrExpression rhs = lowerExpression(pe.rhs());
            if (rhs instanceof IrExpression.Number n) {
                BigInteger folded = pe.operator().fold(n.value(), prime);
                if (folded != null) return new IrExpression.Number(pe.meta(), folded);
            }
            return new IrExpression.Prefix(pe.meta(), pe.operator(), rhs);
        }
        if (expression instanceof CallExpression ce) {
            return new IrExpression.Call(ce.meta(), ce.name(), lowerAll(ce.arguments()));
        }
        throw new UnsupportedOperationException("Unknown expression " + expression.getClass());
    }
}
