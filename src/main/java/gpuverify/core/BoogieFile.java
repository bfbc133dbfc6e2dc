// Copyright 2020 The Whiley Project Developers
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package gpuverify.core;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * An in-memory Boogie program describing a GPU kernel. The list of top-level
 * declarations is mutable so that passes can add and replace declarations,
 * whilst every declaration, statement and expression is itself immutable. A
 * pass which needs to change a node rebuilds it, along with the path from the
 * enclosing declaration down to it, and then swaps the declaration in using
 * {@link #replace(Decl, Decl)}.
 *
 * @author David J. Pearce
 *
 */
public class BoogieFile {

	/**
	 * The list of top-level declarations within this file.
	 */
	private final List<Decl> declarations;

	public BoogieFile() {
		this.declarations = new ArrayList<>();
	}

	public BoogieFile(Collection<? extends Decl> declarations) {
		this.declarations = new ArrayList<>(declarations);
	}

	public List<Decl> getDeclarations() {
		return declarations;
	}

	/**
	 * Create a copy of this file which shares all (immutable) declarations, but
	 * not the declaration list itself.
	 *
	 * @return
	 */
	public BoogieFile copy() {
		return new BoogieFile(declarations);
	}

	public Decl.Procedure getProcedure(String name) {
		for (Decl d : declarations) {
			if (d instanceof Decl.Procedure && ((Decl.Procedure) d).getName().equals(name)) {
				return (Decl.Procedure) d;
			}
		}
		return null;
	}

	public Decl.Implementation getImplementation(String name) {
		for (Decl d : declarations) {
			if (d instanceof Decl.Implementation && ((Decl.Implementation) d).getName().equals(name)) {
				return (Decl.Implementation) d;
			}
		}
		return null;
	}

	public <T extends Decl> List<T> getDeclarations(Class<T> kind) {
		ArrayList<T> result = new ArrayList<>();
		for (Decl d : declarations) {
			if (kind.isInstance(d)) {
				result.add(kind.cast(d));
			}
		}
		return result;
	}

	/**
	 * Replace a given declaration with another. Declarations are compared by
	 * identity, since structurally equal declarations may legitimately appear
	 * more than once.
	 *
	 * @param oldDecl
	 * @param newDecl
	 */
	public void replace(Decl oldDecl, Decl newDecl) {
		for (int i = 0; i != declarations.size(); ++i) {
			if (declarations.get(i) == oldDecl) {
				declarations.set(i, newDecl);
				return;
			}
		}
		throw new IllegalArgumentException("declaration not found (" + oldDecl + ")");
	}

	// =========================================================================
	// Top-Level Item
	// =========================================================================

	public interface Item {
		/**
		 * Get a particular attribute associated with this item.
		 *
		 * @param kind
		 * @param <T>
		 * @return
		 */
		public <T> T getAttribute(Class<T> kind);

		/**
		 * Get all attributes within this item.
		 *
		 * @return
		 */
		public Attribute[] getAttributes();

		/**
		 * Get the Boogie annotation (e.g. <code>{:kernel}</code>) with the given
		 * name, or <code>null</code> if there is none.
		 *
		 * @param name
		 * @return
		 */
		public Annotation getAnnotation(String name);

		public boolean hasAnnotation(String name);
	}

	public static class AbstractItem implements Item {
		private final Attribute[] attributes;

		public AbstractItem(Attribute[] attributes) {
			this.attributes = attributes;
		}

		@Override
		public <T> T getAttribute(Class<T> kind) {
			for (int i = 0; i != attributes.length; ++i) {
				T ith = attributes[i].as(kind);
				if (ith != null) {
					return ith;
				}
			}
			return null;
		}

		@Override
		public Attribute[] getAttributes() {
			return attributes;
		}

		@Override
		public Annotation getAnnotation(String name) {
			for (int i = 0; i != attributes.length; ++i) {
				Annotation ith = attributes[i].as(Annotation.class);
				if (ith != null && ith.getName().equals(name)) {
					return ith;
				}
			}
			return null;
		}

		@Override
		public boolean hasAnnotation(String name) {
			return getAnnotation(name) != null;
		}

		public boolean isFalse() {
			return (this instanceof Expr.Boolean) && !((Expr.Boolean) this).getValue();
		}

		public boolean isTrue() {
			return (this instanceof Expr.Boolean) && ((Expr.Boolean) this).getValue();
		}
	}

	// =========================================================================
	// Declarations
	// =========================================================================

	public interface Decl extends Item {

		/**
		 * Axioms postulate properties of constants and functions. Axioms which
		 * mention thread-local constants such as <code>_X</code> must be dualised
		 * along with everything else, since they otherwise constrain only one of
		 * the two threads.
		 *
		 * @author David J. Pearce
		 *
		 */
		public static class Axiom extends AbstractItem implements Decl {
			private final Expr.Logical operand;

			public Axiom(Expr.Logical operand, Attribute... attributes) {
				super(attributes);
				this.operand = operand;
			}

			public Expr.Logical getOperand() {
				return operand;
			}
		}

		/**
		 * Allows a line comment to be included in a <code>BoogieFile</code>.
		 *
		 * @author David J. Pearce
		 *
		 */
		public static class LineComment extends AbstractItem implements Decl {
			private final String message;

			public LineComment(String message, Attribute... attributes) {
				super(attributes);
				this.message = message;
			}

			public String getMessage() {
				return message;
			}
		}

		/**
		 * Represents a global (symbolic) constant value. Kernels use constants for
		 * the thread and group identifiers (e.g. <code>_X</code> and
		 * <code>_TILE_X</code>), for the group dimensions and for the existential
		 * booleans which gate candidate invariants:
		 *
		 * <pre>
		 * const _X : bv32;
		 * const _TILE_SIZE_X : bv32;
		 * const {:existential true} _b0 : bool;
		 * </pre>
		 *
		 * @author David J. Pearce
		 *
		 */
		public static class Constant extends Parameter implements Decl {
			private final boolean unique;

			public Constant(String name, Type type, Attribute... attributes) {
				this(false, name, type, attributes);
			}

			public Constant(boolean unique, String name, Type type, Attribute... attributes) {
				super(name, type, attributes);
				this.unique = unique;
			}

			public boolean isUnique() {
				return unique;
			}

			public Constant withName(String name) {
				return new Constant(unique, name, getType(), getAttributes());
			}
		}

		public static class Function extends AbstractItem implements Decl {
			private final String name;
			private final List<Parameter> parameters;
			private final Type returns;
			private final Expr body;

			public Function(String name, List<Parameter> parameters, Type returns, Expr body,
					Attribute... attributes) {
				super(attributes);
				this.name = name;
				this.parameters = ImmutableList.copyOf(parameters);
				this.returns = returns;
				this.body = body;
			}

			public String getName() {
				return name;
			}

			public List<Parameter> getParameters() {
				return parameters;
			}

			public Type getReturns() {
				return returns;
			}

			public Expr getBody() {
				return body;
			}
		}

		/**
		 * A procedure declaration gives the signature and contract of a
		 * procedure. Its body, if any, is given separately by one or more
		 * {@link Implementation} declarations of the same name.
		 *
		 * @author David J. Pearce
		 *
		 */
		public static class Procedure extends AbstractItem implements Decl {
			private final String name;
			private final List<Parameter> parameters;
			private final List<Parameter> returns;
			private final List<Expr.Logical> requires;
			private final List<Expr.Logical> freeRequires;
			private final List<Expr.Logical> ensures;
			private final List<Expr.Logical> freeEnsures;
			private final List<String> modifies;

			public Procedure(String name, List<Parameter> parameters, List<Parameter> returns,
					List<Expr.Logical> requires, List<Expr.Logical> ensures, List<String> modifies,
					Attribute... attributes) {
				this(name, parameters, returns, requires, ensures, Collections.emptyList(),
						Collections.emptyList(), modifies, attributes);
			}

			public Procedure(String name, List<Parameter> parameters, List<Parameter> returns,
					List<Expr.Logical> requires, List<Expr.Logical> ensures, List<Expr.Logical> freeRequires,
					List<Expr.Logical> freeEnsures, List<String> modifies, Attribute... attributes) {
				super(attributes);
				this.name = name;
				this.parameters = ImmutableList.copyOf(parameters);
				this.returns = ImmutableList.copyOf(returns);
				this.requires = ImmutableList.copyOf(requires);
				this.ensures = ImmutableList.copyOf(ensures);
				this.freeRequires = ImmutableList.copyOf(freeRequires);
				this.freeEnsures = ImmutableList.copyOf(freeEnsures);
				this.modifies = ImmutableList.copyOf(modifies);
			}

			public String getName() {
				return name;
			}

			public List<Parameter> getParameters() {
				return parameters;
			}

			public List<Parameter> getReturns() {
				return returns;
			}

			public List<Expr.Logical> getRequires() {
				return requires;
			}

			public List<Expr.Logical> getEnsures() {
				return ensures;
			}

			public List<Expr.Logical> getFreeRequires() {
				return freeRequires;
			}

			public List<Expr.Logical> getFreeEnsures() {
				return freeEnsures;
			}

			public List<String> getModifies() {
				return modifies;
			}

			public Procedure withSignature(List<Parameter> parameters, List<Parameter> returns) {
				return new Procedure(name, parameters, returns, requires, ensures, freeRequires, freeEnsures,
						modifies, getAttributes());
			}

			public Procedure withContract(List<Expr.Logical> requires, List<Expr.Logical> ensures) {
				return new Procedure(name, parameters, returns, requires, ensures, freeRequires, freeEnsures,
						modifies, getAttributes());
			}

			public Procedure withFreeContract(List<Expr.Logical> freeRequires, List<Expr.Logical> freeEnsures) {
				return new Procedure(name, parameters, returns, requires, ensures, freeRequires, freeEnsures,
						modifies, getAttributes());
			}

			public Procedure withModifies(List<String> modifies) {
				return new Procedure(name, parameters, returns, requires, ensures, freeRequires, freeEnsures,
						modifies, getAttributes());
			}

			public Procedure withAttributes(Attribute... attributes) {
				return new Procedure(name, parameters, returns, requires, ensures, freeRequires, freeEnsures,
						modifies, attributes);
			}
		}

		/**
		 * An implementation declaration spells out a set of execution traces by
		 * giving a body of code for a previously declared procedure.
		 *
		 * @author djp
		 *
		 */
		public static class Implementation extends AbstractItem implements Decl {
			private final String name;
			private final List<Parameter> parameters;
			private final List<Parameter> returns;
			private final List<Decl.Variable> locals;
			private final Stmt body;

			public Implementation(String name, List<Parameter> parameters, List<Parameter> returns,
					List<Decl.Variable> locals, Stmt body, Attribute... attributes) {
				super(attributes);
				this.name = name;
				this.parameters = ImmutableList.copyOf(parameters);
				this.returns = ImmutableList.copyOf(returns);
				this.locals = ImmutableList.copyOf(locals);
				this.body = Preconditions.checkNotNull(body);
			}

			public String getName() {
				return name;
			}

			public List<Parameter> getParameters() {
				return parameters;
			}

			public List<Parameter> getReturns() {
				return returns;
			}

			public List<Decl.Variable> getLocals() {
				return locals;
			}

			public Stmt getBody() {
				return body;
			}

			public Implementation withSignature(List<Parameter> parameters, List<Parameter> returns) {
				return new Implementation(name, parameters, returns, locals, body, getAttributes());
			}

			public Implementation withLocals(List<Decl.Variable> locals) {
				return new Implementation(name, parameters, returns, locals, body, getAttributes());
			}

			public Implementation withBody(Stmt body) {
				return new Implementation(name, parameters, returns, locals, body, getAttributes());
			}

			public Implementation withAttributes(Attribute... attributes) {
				return new Implementation(name, parameters, returns, locals, body, attributes);
			}
		}

		public static class Parameter extends AbstractItem implements Item {
			private final String name;
			private final Type type;

			public Parameter(String name, Type type, Attribute... attributes) {
				super(attributes);
				this.name = name;
				this.type = type;
			}

			public String getName() {
				return name;
			}

			public Type getType() {
				return type;
			}

			public Parameter withName(String name) {
				return new Parameter(name, type, getAttributes());
			}

			@Override
			public String toString() {
				return name + " : " + type;
			}
		}

		/**
		 * A type synonym is simply an abbreviation for the given type. A synonym
		 * with no right-hand side declares an uninterpreted type.
		 *
		 * @author djp
		 *
		 */
		public static class TypeSynonym extends AbstractItem implements Decl {
			private final String name;
			private final Type synonym;

			public TypeSynonym(String name, Type synonym, Attribute... attributes) {
				super(attributes);
				this.name = name;
				this.synonym = synonym;
			}

			public String getName() {
				return name;
			}

			public Type getSynonym() {
				return synonym;
			}
		}

		/**
		 * A global or local variable. Global variables carrying a
		 * <code>{:group_shared}</code> or <code>{:global}</code> annotation
		 * describe the arrays a kernel shares between threads.
		 */
		public static class Variable extends Parameter implements Decl {
			private final Expr.Logical invariant;

			public Variable(String name, Type type, Attribute... attributes) {
				this(name, type, null, attributes);
			}

			public Variable(String name, Type type, Expr.Logical invariant, Attribute... attributes) {
				super(name, type, attributes);
				this.invariant = invariant;
			}

			public Expr.Logical getInvariant() {
				return invariant;
			}

			@Override
			public Variable withName(String name) {
				return new Variable(name, getType(), invariant, getAttributes());
			}

			public Variable withType(Type type) {
				return new Variable(getName(), type, invariant, getAttributes());
			}
		}
	};

	// =========================================================================
	// Statements
	// =========================================================================

	public interface Stmt extends Item {

		public static class Assert extends AbstractItem implements Stmt {
			private final Expr.Logical condition;

			private Assert(Expr.Logical condition, Attribute[] attributes) {
				super(attributes);
				this.condition = condition;
			}

			public Expr.Logical getCondition() {
				return condition;
			}
		}

		public static class Assume extends AbstractItem implements Stmt {
			private final Expr.Logical condition;

			private Assume(Expr.Logical condition, Attribute[] attributes) {
				super(attributes);
				this.condition = condition;
			}

			public Expr.Logical getCondition() {
				return condition;
			}
		}

		/**
		 * A (possibly parallel) assignment <code>x, y := e1, e2</code>. Most
		 * passes only deal with the single assignment form.
		 */
		public static class Assignment extends AbstractItem implements Stmt {
			private final List<LVal> lhs;
			private final List<Expr> rhs;

			private Assignment(List<LVal> lhs, List<Expr> rhs, Attribute[] attributes) {
				super(attributes);
				Preconditions.checkArgument(lhs.size() == rhs.size() && !lhs.isEmpty(),
						"mismatched assignment (%s := %s)", lhs, rhs);
				this.lhs = ImmutableList.copyOf(lhs);
				this.rhs = ImmutableList.copyOf(rhs);
			}

			public int size() {
				return lhs.size();
			}

			public List<LVal> getLeftHandSides() {
				return lhs;
			}

			public List<Expr> getRightHandSides() {
				return rhs;
			}

			public LVal getLeftHandSide() {
				Preconditions.checkState(lhs.size() == 1, "multi-assignment encountered");
				return lhs.get(0);
			}

			public Expr getRightHandSide() {
				Preconditions.checkState(rhs.size() == 1, "multi-assignment encountered");
				return rhs.get(0);
			}
		}

		public static class Call extends AbstractItem implements Stmt {
			private final String name;
			private final List<LVal> lvals;
			private final List<Expr> arguments;

			private Call(String name, List<? extends LVal> lvals, Collection<? extends Expr> arguments,
					Attribute[] attributes) {
				super(attributes);
				this.name = name;
				this.lvals = ImmutableList.copyOf(lvals);
				this.arguments = ImmutableList.copyOf(arguments);
			}

			public String getName() {
				return name;
			}

			public List<LVal> getLVals() {
				return lvals;
			}

			public List<Expr> getArguments() {
				return arguments;
			}
		}

		public static class Havoc extends AbstractItem implements Stmt {
			private final List<Expr.VariableAccess> variables;

			private Havoc(List<Expr.VariableAccess> variables, Attribute[] attributes) {
				super(attributes);
				Preconditions.checkArgument(!variables.isEmpty(), "empty havoc");
				this.variables = ImmutableList.copyOf(variables);
			}

			public List<Expr.VariableAccess> getVariables() {
				return variables;
			}
		}

		public static class Label extends AbstractItem implements Stmt {
			private final String label;

			private Label(String label, Attribute[] attributes) {
				super(attributes);
				this.label = label;
			}

			public String getLabel() {
				return label;
			}
		}

		/**
		 * Represents <code>if(c) { ... } else if(d) { ... } else { ... }</code>.
		 * At most one of the <code>else if</code> branch and the false branch is
		 * present.
		 */
		public static class IfElse extends AbstractItem implements Stmt {
			private final Expr.Logical condition;
			private final Stmt trueBranch;
			private final IfElse elseIf;
			private final Stmt falseBranch;

			private IfElse(Expr.Logical condition, Stmt trueBranch, IfElse elseIf, Stmt falseBranch,
					Attribute... attributes) {
				super(attributes);
				Preconditions.checkArgument(elseIf == null || falseBranch == null,
						"if statement cannot have both else-if and else branches");
				this.condition = condition;
				this.trueBranch = trueBranch;
				this.elseIf = elseIf;
				this.falseBranch = falseBranch;
			}

			public Expr.Logical getCondition() {
				return condition;
			}

			public Stmt getTrueBranch() {
				return trueBranch;
			}

			public IfElse getElseIf() {
				return elseIf;
			}

			public Stmt getFalseBranch() {
				return falseBranch;
			}
		}

		public static class While extends AbstractItem implements Stmt {
			private final Expr.Logical condition;
			private final List<Expr.Logical> invariant;
			private final Stmt body;

			private While(Expr.Logical condition, List<Expr.Logical> invariant, Stmt body,
					Attribute... attributes) {
				super(attributes);
				this.condition = condition;
				this.invariant = ImmutableList.copyOf(invariant);
				this.body = body;
			}

			public Expr.Logical getCondition() {
				return condition;
			}

			public List<Expr.Logical> getInvariant() {
				return invariant;
			}

			public Stmt getBody() {
				return body;
			}
		}

		public static class Break extends AbstractItem implements Stmt {
			private final String label;

			private Break(String label, Attribute... attributes) {
				super(attributes);
				this.label = label;
			}

			/**
			 * Get the label targeted by this break, or <code>null</code> if it
			 * targets the innermost enclosing loop.
			 *
			 * @return
			 */
			public String getLabel() {
				return label;
			}
		}

		public static class Return extends AbstractItem implements Stmt {
			private Return(Attribute... attributes) {
				super(attributes);
			}
		}

		public static class Sequence extends AbstractItem implements Stmt {
			private final List<Stmt> stmts;

			private Sequence(Collection<? extends Stmt> stmts, Attribute[] attributes) {
				super(attributes);
				this.stmts = ImmutableList.copyOf(stmts);
			}

			public int size() {
				return stmts.size();
			}

			public Stmt get(int i) {
				return stmts.get(i);
			}

			public List<Stmt> getAll() {
				return stmts;
			}
		}
	}

	// =========================================================================
	// Expressions
	// =========================================================================

	public interface Expr extends Item {

		public interface Logical extends Expr {
			public boolean isFalse();

			public boolean isTrue();
		}

		public interface Quantifier extends Logical {
			public List<Decl.Parameter> getParameters();

			public Expr.Logical getBody();
		}

		public interface UnaryOperator {
			Expr getOperand();
		}

		public interface BinaryOperator {
			Expr getLeftHandSide();

			Expr getRightHandSide();
		}

		public interface NaryOperator {
			List<? extends Expr> getOperands();
		}

		public abstract static class AbstractBinaryOperator extends AbstractItem implements BinaryOperator {
			private final Expr lhs;
			private final Expr rhs;

			private AbstractBinaryOperator(Expr lhs, Expr rhs, Attribute[] attributes) {
				super(attributes);
				this.lhs = Preconditions.checkNotNull(lhs);
				this.rhs = Preconditions.checkNotNull(rhs);
			}

			@Override
			public Expr getLeftHandSide() {
				return lhs;
			}

			@Override
			public Expr getRightHandSide() {
				return rhs;
			}
		}

		public static class Equals extends AbstractBinaryOperator implements Logical {
			private Equals(Expr lhs, Expr rhs, Attribute[] attributes) {
				super(lhs, rhs, attributes);
			}
		}

		public static class NotEquals extends AbstractBinaryOperator implements Logical {
			private NotEquals(Expr lhs, Expr rhs, Attribute[] attributes) {
				super(lhs, rhs, attributes);
			}
		}

		public static class LessThan extends AbstractBinaryOperator implements Logical {
			private LessThan(Expr lhs, Expr rhs, Attribute[] attributes) {
				super(lhs, rhs, attributes);
			}
		}

		public static class LessThanOrEqual extends AbstractBinaryOperator implements Logical {
			private LessThanOrEqual(Expr lhs, Expr rhs, Attribute[] attributes) {
				super(lhs, rhs, attributes);
			}
		}

		public static class GreaterThan extends AbstractBinaryOperator implements Logical {
			private GreaterThan(Expr lhs, Expr rhs, Attribute[] attributes) {
				super(lhs, rhs, attributes);
			}
		}

		public static class GreaterThanOrEqual extends AbstractBinaryOperator implements Logical {
			private GreaterThanOrEqual(Expr lhs, Expr rhs, Attribute[] attributes) {
				super(lhs, rhs, attributes);
			}
		}

		public static class Iff extends AbstractBinaryOperator implements Logical {
			private Iff(Logical lhs, Logical rhs, Attribute[] attributes) {
				super(lhs, rhs, attributes);
			}

			@Override
			public Logical getLeftHandSide() {
				return (Logical) super.getLeftHandSide();
			}

			@Override
			public Logical getRightHandSide() {
				return (Logical) super.getRightHandSide();
			}
		}

		public static class Implies extends AbstractBinaryOperator implements Logical {
			private Implies(Logical lhs, Logical rhs, Attribute[] attributes) {
				super(lhs, rhs, attributes);
			}

			@Override
			public Logical getLeftHandSide() {
				return (Logical) super.getLeftHandSide();
			}

			@Override
			public Logical getRightHandSide() {
				return (Logical) super.getRightHandSide();
			}
		}

		public static class Addition extends AbstractBinaryOperator implements Expr {
			private Addition(Expr lhs, Expr rhs, Attribute[] attributes) {
				super(lhs, rhs, attributes);
			}
		}

		public static class Subtraction extends AbstractBinaryOperator implements Expr {
			private Subtraction(Expr lhs, Expr rhs, Attribute[] attributes) {
				super(lhs, rhs, attributes);
			}
		}

		public static class Multiplication extends AbstractBinaryOperator implements Expr {
			private Multiplication(Expr lhs, Expr rhs, Attribute[] attributes) {
				super(lhs, rhs, attributes);
			}
		}

		public static class Division extends AbstractBinaryOperator implements Expr {
			private Division(Expr lhs, Expr rhs, Attribute[] attributes) {
				super(lhs, rhs, attributes);
			}
		}

		public static class IntegerDivision extends AbstractBinaryOperator implements Expr {
			private IntegerDivision(Expr lhs, Expr rhs, Attribute[] attributes) {
				super(lhs, rhs, attributes);
			}
		}

		public static class Remainder extends AbstractBinaryOperator implements Expr {
			private Remainder(Expr lhs, Expr rhs, Attribute[] attributes) {
				super(lhs, rhs, attributes);
			}
		}

		public static class Boolean extends AbstractItem implements Logical {
			private final boolean value;

			private Boolean(boolean v, Attribute[] attributes) {
				super(attributes);
				this.value = v;
			}

			public boolean getValue() {
				return value;
			}

			@Override
			public String toString() {
				return java.lang.Boolean.toString(value);
			}
		}

		public static class Integer extends AbstractItem implements Expr {
			private final BigInteger value;

			private Integer(BigInteger v, Attribute[] attributes) {
				super(attributes);
				this.value = v;
			}

			public BigInteger getValue() {
				return value;
			}

			@Override
			public String toString() {
				return "INT(" + value + ")";
			}
		}

		/**
		 * A bit-vector literal such as <code>0bv32</code>.
		 */
		public static class BitVectorConstant extends AbstractItem implements Expr {
			private final BigInteger value;
			private final int width;

			private BitVectorConstant(BigInteger value, int width, Attribute[] attributes) {
				super(attributes);
				Preconditions.checkArgument(value.signum() >= 0 && value.bitLength() <= width,
						"bit-vector literal %s does not fit in %s bits", value, width);
				this.value = value;
				this.width = width;
			}

			public BigInteger getValue() {
				return value;
			}

			public int getWidth() {
				return width;
			}

			@Override
			public String toString() {
				return "BV(" + value + "," + width + ")";
			}
		}

		/**
		 * A map select <code>M[i]</code>, or <code>M[i,j]</code> for a map with
		 * more than one key. A chain <code>A[i][j]</code> is a select whose
		 * source is itself a select.
		 */
		public static class DictionaryAccess extends AbstractItem implements LVal, Logical {
			private final Expr source;
			private final List<Expr> indices;

			private DictionaryAccess(Expr source, List<Expr> indices, Attribute[] attributes) {
				super(attributes);
				Preconditions.checkArgument(!indices.isEmpty(), "map select requires an index");
				this.source = source;
				this.indices = ImmutableList.copyOf(indices);
			}

			public Expr getSource() {
				return source;
			}

			public List<Expr> getIndices() {
				return indices;
			}

			public Expr getIndex() {
				Preconditions.checkState(indices.size() == 1, "multi-index map select encountered");
				return indices.get(0);
			}

			@Override
			public String toString() {
				return "GET(" + source + ", " + indices + ")";
			}
		}

		public static class DictionaryUpdate extends AbstractItem implements Expr {
			private final Expr source;
			private final List<Expr> indices;
			private final Expr value;

			private DictionaryUpdate(Expr source, List<Expr> indices, Expr value, Attribute[] attributes) {
				super(attributes);
				Preconditions.checkArgument(!indices.isEmpty(), "map update requires an index");
				this.source = source;
				this.indices = ImmutableList.copyOf(indices);
				this.value = value;
			}

			public Expr getSource() {
				return source;
			}

			public List<Expr> getIndices() {
				return indices;
			}

			public Expr getValue() {
				return value;
			}

			@Override
			public String toString() {
				return "PUT(" + source + ", " + indices + "," + value + ")";
			}
		}

		public static class Invoke extends AbstractItem implements Logical {
			private final String name;
			private final List<Expr> arguments;

			private Invoke(String name, Collection<? extends Expr> arguments, Attribute[] attributes) {
				super(attributes);
				this.name = name;
				this.arguments = ImmutableList.copyOf(arguments);
			}

			public String getName() {
				return name;
			}

			public List<Expr> getArguments() {
				return arguments;
			}

			@Override
			public String toString() {
				return "FNCALL(" + name + "," + arguments.toString() + ")";
			}
		}

		/**
		 * The conditional expression <code>if c then e1 else e2</code>, used by
		 * predication to guard updates.
		 */
		public static class IfThenElse extends AbstractItem implements Logical {
			private final Logical condition;
			private final Expr trueBranch;
			private final Expr falseBranch;

			private IfThenElse(Logical condition, Expr trueBranch, Expr falseBranch, Attribute[] attributes) {
				super(attributes);
				this.condition = condition;
				this.trueBranch = trueBranch;
				this.falseBranch = falseBranch;
			}

			public Logical getCondition() {
				return condition;
			}

			public Expr getTrueBranch() {
				return trueBranch;
			}

			public Expr getFalseBranch() {
				return falseBranch;
			}
		}

		public static class Negation extends AbstractItem implements Expr, UnaryOperator {
			private final Expr operand;

			private Negation(Expr operand, Attribute[] attributes) {
				super(attributes);
				this.operand = operand;
			}

			@Override
			public Expr getOperand() {
				return operand;
			}
		}

		public static class Old extends AbstractItem implements Logical, UnaryOperator {
			private final Expr operand;

			private Old(Expr operand, Attribute[] attributes) {
				super(attributes);
				this.operand = operand;
			}

			@Override
			public Expr getOperand() {
				return operand;
			}

			@Override
			public String toString() {
				return "OLD(" + operand + ")";
			}
		}

		public static class LogicalNot extends AbstractItem implements Logical, UnaryOperator {
			private final Logical operand;

			private LogicalNot(Logical operand, Attribute[] attributes) {
				super(attributes);
				this.operand = operand;
			}

			@Override
			public Logical getOperand() {
				return operand;
			}

			@Override
			public String toString() {
				return "NOT(" + operand + ")";
			}
		}

		public static class LogicalAnd extends AbstractItem implements Logical, NaryOperator {
			private final List<Logical> operands;

			private LogicalAnd(List<Logical> operands, Attribute[] attributes) {
				super(attributes);
				this.operands = ImmutableList.copyOf(operands);
			}

			@Override
			public List<Logical> getOperands() {
				return operands;
			}
		}

		public static class LogicalOr extends AbstractItem implements Logical, NaryOperator {
			private final List<Logical> operands;

			private LogicalOr(List<Logical> operands, Attribute[] attributes) {
				super(attributes);
				this.operands = ImmutableList.copyOf(operands);
			}

			@Override
			public List<Logical> getOperands() {
				return operands;
			}
		}

		public static class UniversalQuantifier extends AbstractItem implements Quantifier {
			private final List<Decl.Parameter> parameters;
			private final Logical body;

			private UniversalQuantifier(Collection<Decl.Parameter> parameters, Expr.Logical body,
					Attribute[] attributes) {
				super(attributes);
				this.parameters = ImmutableList.copyOf(parameters);
				this.body = body;
			}

			@Override
			public List<Decl.Parameter> getParameters() {
				return parameters;
			}

			@Override
			public Logical getBody() {
				return body;
			}
		}

		public static class ExistentialQuantifier extends AbstractItem implements Quantifier {
			private final List<Decl.Parameter> parameters;
			private final Logical body;

			private ExistentialQuantifier(Collection<Decl.Parameter> parameters, Expr.Logical body,
					Attribute[] attributes) {
				super(attributes);
				this.parameters = ImmutableList.copyOf(parameters);
				this.body = body;
			}

			@Override
			public List<Decl.Parameter> getParameters() {
				return parameters;
			}

			@Override
			public Logical getBody() {
				return body;
			}
		}

		public static class VariableAccess extends AbstractItem implements Logical, LVal {
			private final String variable;

			private VariableAccess(String var, Attribute[] attributes) {
				super(attributes);
				this.variable = Preconditions.checkNotNull(var);
			}

			public String getVariable() {
				return variable;
			}

			@Override
			public String toString() {
				return "VAR(" + variable + ")";
			}
		}
	}

	/**
	 * Something which can be assigned to: either a variable or a (chain of) map
	 * selects rooted at a variable.
	 */
	public interface LVal extends Expr {

	}

	// =========================================================================
	// Types
	// =========================================================================

	/**
	 * Types are compared structurally, so that e.g. two occurrences of
	 * <code>bv32</code> are equal regardless of where they were created.
	 */
	public interface Type extends Item {
		public static final Type Bool = new Bool();
		public static final Type Int = new Int();
		public static final Type Real = new Real();
		public static final Type BitVector32 = new BitVector(32);

		public static class Bool extends AbstractItem implements Type {
			public Bool(Attribute... attributes) {
				super(attributes);
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof Bool;
			}

			@Override
			public int hashCode() {
				return 1;
			}

			@Override
			public String toString() {
				return "bool";
			}
		}

		public static class Int extends AbstractItem implements Type {
			public Int(Attribute... attributes) {
				super(attributes);
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof Int;
			}

			@Override
			public int hashCode() {
				return 2;
			}

			@Override
			public String toString() {
				return "int";
			}
		}

		public static class Real extends AbstractItem implements Type {
			public Real(Attribute... attributes) {
				super(attributes);
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof Real;
			}

			@Override
			public int hashCode() {
				return 3;
			}

			@Override
			public String toString() {
				return "real";
			}
		}

		public static class Synonym extends AbstractItem implements Type {
			private final String name;

			public Synonym(String name, Attribute... attributes) {
				super(attributes);
				this.name = name;
			}

			public String getSynonym() {
				return name;
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof Synonym && ((Synonym) o).name.equals(name);
			}

			@Override
			public int hashCode() {
				return name.hashCode();
			}

			@Override
			public String toString() {
				return name;
			}
		}

		public static class BitVector extends AbstractItem implements Type {
			private final int digits;

			public BitVector(int digits, Attribute... attributes) {
				super(attributes);
				this.digits = digits;
			}

			public int getDigits() {
				return digits;
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof BitVector && ((BitVector) o).digits == digits;
			}

			@Override
			public int hashCode() {
				return 31 * digits;
			}

			@Override
			public String toString() {
				return "bv" + digits;
			}
		}

		/**
		 * A map type <code>[K1,...,Kn]V</code>. Kernel arrays of more than one
		 * dimension are written as nested maps, e.g. <code>[bv32][bv32]bv8</code>.
		 */
		public static class Dictionary extends AbstractItem implements Type {
			private final List<Type> keys;
			private final Type value;

			public Dictionary(Type key, Type value, Attribute... attributes) {
				this(Arrays.asList(key), value, attributes);
			}

			public Dictionary(List<Type> keys, Type value, Attribute... attributes) {
				super(attributes);
				Preconditions.checkArgument(!keys.isEmpty(), "map type requires a key");
				this.keys = ImmutableList.copyOf(keys);
				this.value = value;
			}

			public List<Type> getKeys() {
				return keys;
			}

			public Type getKey() {
				Preconditions.checkState(keys.size() == 1, "multi-key map type encountered");
				return keys.get(0);
			}

			public Type getValue() {
				return value;
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof Dictionary) {
					Dictionary d = (Dictionary) o;
					return d.keys.equals(keys) && d.value.equals(value);
				}
				return false;
			}

			@Override
			public int hashCode() {
				return Objects.hash(keys, value);
			}

			@Override
			public String toString() {
				StringBuilder sb = new StringBuilder("[");
				for (int i = 0; i != keys.size(); ++i) {
					if (i != 0) {
						sb.append(",");
					}
					sb.append(keys.get(i));
				}
				return sb.append("]").append(value).toString();
			}
		}
	}

	// =========================================================================
	// Attributes
	// =========================================================================

	public interface Attribute {
		/**
		 * Get the contents of this attribute as a given kind. If that doesn't
		 * match, then return <code>null</code>.
		 *
		 * @param kind
		 * @param <T>
		 * @return
		 */
		public <T> T as(Class<T> kind);
	}

	/**
	 * A Boogie annotation such as <code>{:kernel}</code>,
	 * <code>{:existential true}</code> or <code>{:bvbuiltin "bvugt"}</code>.
	 * Each argument is either an {@link Expr} or a string literal.
	 */
	public static class Annotation {
		private final String name;
		private final List<Object> arguments;

		public Annotation(String name, Object... arguments) {
			for (Object arg : arguments) {
				Preconditions.checkArgument(arg instanceof Expr || arg instanceof String,
						"invalid annotation argument: %s", arg);
			}
			this.name = name;
			this.arguments = ImmutableList.copyOf(arguments);
		}

		public String getName() {
			return name;
		}

		public List<Object> getArguments() {
			return arguments;
		}

		@Override
		public String toString() {
			return "{:" + name + (arguments.isEmpty() ? "" : " " + arguments) + "}";
		}
	}

	// =======================================================
	// Constructor API (for convenience)
	// =======================================================

	public static Attribute ATTRIBUTE(Object o) {
		return new Attribute() {
			@Override
			public <T> T as(Class<T> kind) {
				if (kind.isInstance(o)) {
					return kind.cast(o);
				} else {
					return null;
				}
			}

			@Override
			public String toString() {
				return "ATTR(" + o + ")";
			}
		};
	}

	public static Attribute ANNOTATION(String name, Object... arguments) {
		return ATTRIBUTE(new Annotation(name, arguments));
	}

	// Declarations

	public static Decl.Function FUNCTION(String name, List<Decl.Parameter> parameters, Type returns,
			Attribute... attributes) {
		return new Decl.Function(name, parameters, returns, null, attributes);
	}

	public static Decl.Procedure PROCEDURE(String name, List<Decl.Parameter> parameters,
			List<Decl.Parameter> returns, Attribute... attributes) {
		return new Decl.Procedure(name, parameters, returns, Collections.emptyList(), Collections.emptyList(),
				Collections.emptyList(), attributes);
	}

	public static Decl.Implementation IMPLEMENTATION(String name, List<Decl.Parameter> parameters,
			List<Decl.Parameter> returns, List<Decl.Variable> locals, Stmt body, Attribute... attributes) {
		return new Decl.Implementation(name, parameters, returns, locals, body, attributes);
	}

	public static Decl.Variable VARIABLE(String name, Type type, Attribute... attributes) {
		return new Decl.Variable(name, type, attributes);
	}

	public static Decl.Constant CONSTANT(String name, Type type, Attribute... attributes) {
		return new Decl.Constant(name, type, attributes);
	}

	public static Decl.Parameter PARAMETER(String name, Type type, Attribute... attributes) {
		return new Decl.Parameter(name, type, attributes);
	}

	// Statements

	public static Stmt.Assert ASSERT(Expr.Logical condition, Attribute... attributes) {
		return new Stmt.Assert(condition, attributes);
	}

	public static Stmt.Assignment ASSIGN(LVal lhs, Expr rhs, Attribute... attributes) {
		return new Stmt.Assignment(Arrays.asList(lhs), Arrays.asList(rhs), attributes);
	}

	public static Stmt.Assignment ASSIGN(List<LVal> lhs, List<Expr> rhs, Attribute... attributes) {
		return new Stmt.Assignment(lhs, rhs, attributes);
	}

	public static Stmt.Assume ASSUME(Expr.Logical condition, Attribute... attributes) {
		return new Stmt.Assume(condition, attributes);
	}

	public static Stmt.Break BREAK(Attribute... attributes) {
		return new Stmt.Break(null, attributes);
	}

	public static Stmt.Break BREAK(String label, Attribute... attributes) {
		return new Stmt.Break(label, attributes);
	}

	public static Stmt.Call CALL(String name, Expr[] parameters, Attribute... attributes) {
		return new Stmt.Call(name, Collections.emptyList(), Arrays.asList(parameters), attributes);
	}

	public static Stmt.Call CALL(String name, List<? extends Expr> parameters, Attribute... attributes) {
		return new Stmt.Call(name, Collections.emptyList(), parameters, attributes);
	}

	public static Stmt.Call CALL(String name, List<? extends LVal> lvals, List<? extends Expr> parameters,
			Attribute... attributes) {
		return new Stmt.Call(name, lvals, parameters, attributes);
	}

	public static Stmt.Havoc HAVOC(Expr.VariableAccess variable, Attribute... attributes) {
		return new Stmt.Havoc(Arrays.asList(variable), attributes);
	}

	public static Stmt.Havoc HAVOC(List<Expr.VariableAccess> variables, Attribute... attributes) {
		return new Stmt.Havoc(variables, attributes);
	}

	public static Stmt.IfElse IFELSE(Expr.Logical condition, Stmt trueBranch, Stmt falseBranch,
			Attribute... attributes) {
		return new Stmt.IfElse(condition, trueBranch, null, falseBranch, attributes);
	}

	public static Stmt.IfElse IFELSEIF(Expr.Logical condition, Stmt trueBranch, Stmt.IfElse elseIf,
			Attribute... attributes) {
		return new Stmt.IfElse(condition, trueBranch, elseIf, null, attributes);
	}

	public static Stmt.Label LABEL(String label, Attribute... attributes) {
		return new Stmt.Label(label, attributes);
	}

	public static Stmt.While WHILE(Expr.Logical condition, List<Expr.Logical> invariant, Stmt body,
			Attribute... attributes) {
		return new Stmt.While(condition, invariant, body, attributes);
	}

	public static Stmt.Sequence SEQUENCE(List<? extends Stmt> stmts, Attribute... attributes) {
		return new Stmt.Sequence(stmts, attributes);
	}

	public static Stmt.Sequence SEQUENCE(Stmt... stmts) {
		return new Stmt.Sequence(Arrays.asList(stmts), new Attribute[0]);
	}

	public static Stmt.Return RETURN(Attribute... attributes) {
		return new Stmt.Return(attributes);
	}

	// Logical Operators

	public static Expr.Logical AND(List<Expr.Logical> operands, Attribute... attributes) {
		ArrayList<Expr.Logical> noperands = new ArrayList<>();
		for (int i = 0; i != operands.size(); ++i) {
			Expr.Logical ith = operands.get(i);
			if (ith.isFalse()) {
				return new Expr.Boolean(false, attributes);
			} else if (!ith.isTrue()) {
				noperands.add(ith);
			}
		}
		switch (noperands.size()) {
		case 0:
			return new Expr.Boolean(true, attributes);
		case 1:
			return noperands.get(0);
		default:
			return new Expr.LogicalAnd(noperands, attributes);
		}
	}

	public static Expr.Logical AND(Expr.Logical operand1, Expr.Logical operand2, Attribute... attributes) {
		return AND(Arrays.asList(operand1, operand2), attributes);
	}

	public static Expr.Logical AND(Expr.Logical operand1, Expr.Logical operand2, Expr.Logical operand3,
			Attribute... attributes) {
		return AND(Arrays.asList(operand1, operand2, operand3), attributes);
	}

	/**
	 * Construct a conjunction without any simplification. Predication relies on
	 * this to produce <code>true &amp;&amp; G</code> for loops at the top level,
	 * keeping the shape of generated code independent of the incoming predicate.
	 *
	 * @param operands
	 * @param attributes
	 * @return
	 */
	public static Expr.Logical CONJOIN(List<Expr.Logical> operands, Attribute... attributes) {
		Preconditions.checkArgument(!operands.isEmpty(), "empty conjunction");
		if (operands.size() == 1) {
			return operands.get(0);
		}
		return new Expr.LogicalAnd(operands, attributes);
	}

	public static Expr.Logical CONJOIN(Expr.Logical operand1, Expr.Logical operand2, Attribute... attributes) {
		return new Expr.LogicalAnd(Arrays.asList(operand1, operand2), attributes);
	}

	/**
	 * Construct a disjunction without any simplification.
	 *
	 * @param operands
	 * @param attributes
	 * @return
	 */
	public static Expr.Logical DISJOIN(List<Expr.Logical> operands, Attribute... attributes) {
		Preconditions.checkArgument(!operands.isEmpty(), "empty disjunction");
		if (operands.size() == 1) {
			return operands.get(0);
		}
		return new Expr.LogicalOr(operands, attributes);
	}

	public static Expr.Logical DISJOIN(Expr.Logical operand1, Expr.Logical operand2, Attribute... attributes) {
		return new Expr.LogicalOr(Arrays.asList(operand1, operand2), attributes);
	}

	public static Expr.UniversalQuantifier FORALL(String name, Type type, Expr.Logical body,
			Attribute... attributes) {
		return new Expr.UniversalQuantifier(Arrays.asList(new Decl.Parameter(name, type)), body, attributes);
	}

	public static Expr.UniversalQuantifier FORALL(List<Decl.Parameter> parameters, Expr.Logical body,
			Attribute... attributes) {
		return new Expr.UniversalQuantifier(parameters, body, attributes);
	}

	public static Expr.ExistentialQuantifier EXISTS(String name, Type type, Expr.Logical body,
			Attribute... attributes) {
		return new Expr.ExistentialQuantifier(Arrays.asList(new Decl.Parameter(name, type)), body, attributes);
	}

	public static Expr.ExistentialQuantifier EXISTS(List<Decl.Parameter> parameters, Expr.Logical body,
			Attribute... attributes) {
		return new Expr.ExistentialQuantifier(parameters, body, attributes);
	}

	public static Expr.Logical IFF(Expr.Logical lhs, Expr.Logical rhs, Attribute... attributes) {
		return new Expr.Iff(lhs, rhs, attributes);
	}

	public static Expr.Logical IMPLIES(Expr.Logical lhs, Expr.Logical rhs, Attribute... attributes) {
		if (lhs.isTrue()) {
			return rhs;
		} else {
			return new Expr.Implies(lhs, rhs, attributes);
		}
	}

	public static Expr.Logical NOT(Expr.Logical lhs, Attribute... attributes) {
		if (lhs.isFalse()) {
			return new Expr.Boolean(true, attributes);
		} else if (lhs.isTrue()) {
			return new Expr.Boolean(false, attributes);
		} else {
			return new Expr.LogicalNot(lhs, attributes);
		}
	}

	public static Expr.Logical OR(List<Expr.Logical> operands, Attribute... attributes) {
		ArrayList<Expr.Logical> noperands = new ArrayList<>();
		for (int i = 0; i != operands.size(); ++i) {
			Expr.Logical ith = operands.get(i);
			if (ith.isTrue()) {
				return new Expr.Boolean(true, attributes);
			} else if (!ith.isFalse()) {
				noperands.add(ith);
			}
		}
		switch (noperands.size()) {
		case 0:
			return new Expr.Boolean(false, attributes);
		case 1:
			return noperands.get(0);
		default:
			return new Expr.LogicalOr(noperands, attributes);
		}
	}

	public static Expr.Logical OR(Expr.Logical operand1, Expr.Logical operand2, Attribute... attributes) {
		return OR(Arrays.asList(operand1, operand2), attributes);
	}

	public static Expr.IfThenElse ITE(Expr.Logical condition, Expr trueBranch, Expr falseBranch,
			Attribute... attributes) {
		return new Expr.IfThenElse(condition, trueBranch, falseBranch, attributes);
	}

	// Relational Operators

	public static Expr.Equals EQ(Expr lhs, Expr rhs, Attribute... attributes) {
		return new Expr.Equals(lhs, rhs, attributes);
	}

	public static Expr.NotEquals NEQ(Expr lhs, Expr rhs, Attribute... attributes) {
		return new Expr.NotEquals(lhs, rhs, attributes);
	}

	public static Expr.GreaterThanOrEqual GTEQ(Expr lhs, Expr rhs, Attribute... attributes) {
		return new Expr.GreaterThanOrEqual(lhs, rhs, attributes);
	}

	public static Expr.GreaterThan GT(Expr lhs, Expr rhs, Attribute... attributes) {
		return new Expr.GreaterThan(lhs, rhs, attributes);
	}

	public static Expr.LessThanOrEqual LTEQ(Expr lhs, Expr rhs, Attribute... attributes) {
		return new Expr.LessThanOrEqual(lhs, rhs, attributes);
	}

	public static Expr.LessThan LT(Expr lhs, Expr rhs, Attribute... attributes) {
		return new Expr.LessThan(lhs, rhs, attributes);
	}

	// Arithmetic Operators

	public static Expr.Addition ADD(Expr lhs, Expr rhs, Attribute... attributes) {
		return new Expr.Addition(lhs, rhs, attributes);
	}

	public static Expr.Negation NEG(Expr lhs, Attribute... attributes) {
		return new Expr.Negation(lhs, attributes);
	}

	public static Expr.Subtraction SUB(Expr lhs, Expr rhs, Attribute... attributes) {
		return new Expr.Subtraction(lhs, rhs, attributes);
	}

	public static Expr.Multiplication MUL(Expr lhs, Expr rhs, Attribute... attributes) {
		return new Expr.Multiplication(lhs, rhs, attributes);
	}

	public static Expr.Division DIV(Expr lhs, Expr rhs, Attribute... attributes) {
		return new Expr.Division(lhs, rhs, attributes);
	}

	public static Expr.IntegerDivision IDIV(Expr lhs, Expr rhs, Attribute... attributes) {
		return new Expr.IntegerDivision(lhs, rhs, attributes);
	}

	public static Expr.Remainder REM(Expr lhs, Expr rhs, Attribute... attributes) {
		return new Expr.Remainder(lhs, rhs, attributes);
	}

	// Dictionaries

	public static Expr.DictionaryAccess GET(Expr src, Expr index, Attribute... attributes) {
		return new Expr.DictionaryAccess(src, Arrays.asList(index), attributes);
	}

	public static Expr.DictionaryAccess GET(Expr src, List<Expr> indices, Attribute... attributes) {
		return new Expr.DictionaryAccess(src, indices, attributes);
	}

	public static Expr.DictionaryUpdate PUT(Expr src, Expr index, Expr value, Attribute... attributes) {
		return new Expr.DictionaryUpdate(src, Arrays.asList(index), value, attributes);
	}

	public static Expr.DictionaryUpdate PUT(Expr src, List<Expr> indices, Expr value, Attribute... attributes) {
		return new Expr.DictionaryUpdate(src, indices, value, attributes);
	}

	// Misc

	public static Expr.Logical CONST(boolean b, Attribute... attributes) {
		return new Expr.Boolean(b, attributes);
	}

	public static Expr.Integer CONST(int i, Attribute... attributes) {
		return new Expr.Integer(BigInteger.valueOf(i), attributes);
	}

	public static Expr.Integer CONST(BigInteger i, Attribute... attributes) {
		return new Expr.Integer(i, attributes);
	}

	public static Expr.BitVectorConstant BV(long value, int width, Attribute... attributes) {
		return new Expr.BitVectorConstant(BigInteger.valueOf(value), width, attributes);
	}

	public static Expr.BitVectorConstant BV(BigInteger value, int width, Attribute... attributes) {
		return new Expr.BitVectorConstant(value, width, attributes);
	}

	public static Expr.Old OLD(Expr lhs, Attribute... attributes) {
		return new Expr.Old(lhs, attributes);
	}

	public static Expr.Invoke INVOKE(String name, Expr... parameters) {
		return new Expr.Invoke(name, Arrays.asList(parameters), new Attribute[0]);
	}

	public static Expr.Invoke INVOKE(String name, List<? extends Expr> parameters, Attribute... attributes) {
		return new Expr.Invoke(name, parameters, attributes);
	}

	public static Expr.VariableAccess VAR(String name, Attribute... attributes) {
		return new Expr.VariableAccess(name, attributes);
	}
}
