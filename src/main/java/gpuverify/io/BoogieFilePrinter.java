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
package gpuverify.io;

import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.List;

import gpuverify.core.BoogieFile;
import gpuverify.core.BoogieFile.Annotation;
import gpuverify.core.BoogieFile.Attribute;
import gpuverify.core.BoogieFile.Decl;
import gpuverify.core.BoogieFile.Expr;
import gpuverify.core.BoogieFile.LVal;
import gpuverify.core.BoogieFile.Stmt;
import gpuverify.core.BoogieFile.Type;

/**
 * Writes a {@link BoogieFile} out as Boogie source text. The output is what
 * gets handed to the verifier, and is also what tests compare against.
 *
 * @author David J. Pearce
 *
 */
public class BoogieFilePrinter {
	private final PrintWriter out;

	public BoogieFilePrinter(OutputStream output) {
		this(new OutputStreamWriter(output, StandardCharsets.UTF_8));
	}

	public BoogieFilePrinter(Writer output) {
		this.out = new PrintWriter(output);
	}

	public void flush() {
		out.flush();
	}

	public void write(BoogieFile file) {
		for (Decl d : file.getDeclarations()) {
			writeDecl(0, d);
		}
		out.flush();
	}

	public void write(Decl d) {
		writeDecl(0, d);
		out.flush();
	}

	private void tab(int indent) {
		for (int i = 0; i < indent; ++i) {
			out.print("\t");
		}
	}

	private void writeDecl(int indent, Decl d) {
		if (d == null) {
			out.println();
		} else if (d instanceof Decl.Axiom) {
			writeAxiom(indent, (Decl.Axiom) d);
		} else if (d instanceof Decl.Constant) {
			writeConstant(indent, (Decl.Constant) d);
		} else if (d instanceof Decl.Function) {
			writeFunction(indent, (Decl.Function) d);
		} else if (d instanceof Decl.Implementation) {
			writeImplementation(indent, (Decl.Implementation) d);
		} else if (d instanceof Decl.LineComment) {
			writeLineComment(indent, (Decl.LineComment) d);
		} else if (d instanceof Decl.Procedure) {
			writeProcedure(indent, (Decl.Procedure) d);
		} else if (d instanceof Decl.TypeSynonym) {
			writeTypeSynonym(indent, (Decl.TypeSynonym) d);
		} else if (d instanceof Decl.Variable) {
			writeVariable(indent, (Decl.Variable) d);
		} else {
			throw new IllegalArgumentException("unknown declaration encountered (" + d.getClass().getName() + ")");
		}
	}

	private void writeAnnotations(BoogieFile.Item item) {
		for (Attribute a : item.getAttributes()) {
			Annotation annotation = a.as(Annotation.class);
			if (annotation != null) {
				out.print("{:");
				out.print(annotation.getName());
				List<Object> args = annotation.getArguments();
				for (int i = 0; i != args.size(); ++i) {
					out.print(i == 0 ? " " : ", ");
					Object arg = args.get(i);
					if (arg instanceof String) {
						out.print("\"" + arg + "\"");
					} else {
						writeExpression((Expr) arg);
					}
				}
				out.print("} ");
			}
		}
	}

	private void writeAxiom(int indent, Decl.Axiom d) {
		tab(indent);
		out.print("axiom ");
		writeAnnotations(d);
		writeExpression(d.getOperand());
		out.println(";");
	}

	private void writeConstant(int indent, Decl.Constant d) {
		tab(indent);
		out.print("const ");
		writeAnnotations(d);
		if (d.isUnique()) {
			out.print("unique ");
		}
		out.print(d.getName());
		out.print(" : ");
		writeType(d.getType());
		out.println(";");
	}

	private void writeImplementation(int indent, Decl.Implementation d) {
		tab(indent);
		out.print("implementation ");
		writeAnnotations(d);
		out.print(d.getName());
		writeParameters(d.getParameters());
		if (!d.getReturns().isEmpty()) {
			out.print(" returns ");
			writeParameters(d.getReturns());
		}
		out.println();
		tab(indent);
		out.println("{");
		List<Decl.Variable> locals = d.getLocals();
		for (int i = 0; i != locals.size(); ++i) {
			writeVariable(indent + 1, locals.get(i));
		}
		writeStmt(indent + 1, d.getBody());
		tab(indent);
		out.println("}");
	}

	private void writeFunction(int indent, Decl.Function d) {
		tab(indent);
		out.print("function ");
		writeAnnotations(d);
		out.print(d.getName());
		writeParameters(d.getParameters());
		out.print(" returns (");
		writeType(d.getReturns());
		out.print(")");
		if (d.getBody() != null) {
			out.println(" {");
			tab(indent + 1);
			writeExpression(d.getBody());
			out.println();
			tab(indent);
			out.println("}");
		} else {
			out.println(";");
		}
	}

	private void writeLineComment(int indent, Decl.LineComment d) {
		tab(indent);
		out.println("// " + d.getMessage());
	}

	private void writeProcedure(int indent, Decl.Procedure d) {
		tab(indent);
		out.print("procedure ");
		writeAnnotations(d);
		out.print(d.getName());
		writeParameters(d.getParameters());
		if (!d.getReturns().isEmpty()) {
			out.print(" returns ");
			writeParameters(d.getReturns());
		}
		out.println(";");
		writeContract(indent + 1, "free requires ", d.getFreeRequires());
		writeContract(indent + 1, "requires ", d.getRequires());
		writeContract(indent + 1, "free ensures ", d.getFreeEnsures());
		writeContract(indent + 1, "ensures ", d.getEnsures());
		List<String> modifies = d.getModifies();
		if (modifies.size() > 0) {
			tab(indent + 1);
			out.print("modifies ");
			for (int i = 0; i != modifies.size(); ++i) {
				if (i != 0) {
					out.print(", ");
				}
				out.print(modifies.get(i));
			}
			out.println(";");
		}
	}

	private void writeContract(int indent, String keyword, List<Expr.Logical> clauses) {
		for (int i = 0; i != clauses.size(); ++i) {
			Expr.Logical ith = clauses.get(i);
			tab(indent);
			out.print(keyword);
			writeAnnotations(ith);
			writeExpression(ith);
			out.println(";");
		}
	}

	private void writeParameters(List<Decl.Parameter> parameters) {
		out.print("(");
		for (int i = 0; i != parameters.size(); ++i) {
			Decl.Parameter ith = parameters.get(i);
			if (i != 0) {
				out.print(", ");
			}
			writeParameter(ith);
		}
		out.print(")");
	}

	private void writeParameter(Decl.Parameter parameter) {
		writeAnnotations(parameter);
		if (parameter.getName() != null) {
			out.print(parameter.getName());
			out.print(" : ");
		}
		writeType(parameter.getType());
	}

	private void writeTypeSynonym(int indent, Decl.TypeSynonym d) {
		tab(indent);
		out.print("type ");
		writeAnnotations(d);
		out.print(d.getName());
		if (d.getSynonym() != null) {
			out.print(" = ");
			writeType(d.getSynonym());
		}
		out.println(";");
	}

	private void writeVariable(int indent, Decl.Variable d) {
		tab(indent);
		out.print("var ");
		writeAnnotations(d);
		out.print(d.getName());
		out.print(" : ");
		writeType(d.getType());
		if (d.getInvariant() != null) {
			out.print(" where ");
			writeExpression(d.getInvariant());
		}
		out.println(";");
	}

	// =========================================================================
	// Statements
	// =========================================================================

	private void writeStmt(int indent, Stmt s) {
		if (s instanceof Stmt.Assignment) {
			writeAssignment(indent, (Stmt.Assignment) s);
		} else if (s instanceof Stmt.Assert) {
			writeAssert(indent, (Stmt.Assert) s);
		} else if (s instanceof Stmt.Assume) {
			writeAssume(indent, (Stmt.Assume) s);
		} else if (s instanceof Stmt.Break) {
			writeBreak(indent, (Stmt.Break) s);
		} else if (s instanceof Stmt.Call) {
			writeCall(indent, (Stmt.Call) s);
		} else if (s instanceof Stmt.Havoc) {
			writeHavoc(indent, (Stmt.Havoc) s);
		} else if (s instanceof Stmt.Label) {
			writeLabel(indent, (Stmt.Label) s);
		} else if (s instanceof Stmt.IfElse) {
			tab(indent);
			writeIfElse(indent, (Stmt.IfElse) s);
		} else if (s instanceof Stmt.Return) {
			writeReturn(indent, (Stmt.Return) s);
		} else if (s instanceof Stmt.Sequence) {
			writeSequence(indent, (Stmt.Sequence) s);
		} else if (s instanceof Stmt.While) {
			writeWhile(indent, (Stmt.While) s);
		} else {
			throw new IllegalArgumentException("unknown statement encountered (" + s.getClass().getName() + ")");
		}
	}

	private void writeAssignment(int indent, Stmt.Assignment s) {
		tab(indent);
		List<LVal> lhs = s.getLeftHandSides();
		List<Expr> rhs = s.getRightHandSides();
		for (int i = 0; i != lhs.size(); ++i) {
			if (i != 0) {
				out.print(", ");
			}
			writeExpression(lhs.get(i));
		}
		out.print(" := ");
		for (int i = 0; i != rhs.size(); ++i) {
			if (i != 0) {
				out.print(", ");
			}
			writeExpression(rhs.get(i));
		}
		out.println(";");
	}

	private void writeAssert(int indent, Stmt.Assert s) {
		tab(indent);
		out.print("assert ");
		writeAnnotations(s);
		writeExpression(s.getCondition());
		out.println(";");
	}

	private void writeAssume(int indent, Stmt.Assume s) {
		tab(indent);
		out.print("assume ");
		writeAnnotations(s);
		writeExpression(s.getCondition());
		out.println(";");
	}

	private void writeBreak(int indent, Stmt.Break s) {
		tab(indent);
		if (s.getLabel() == null) {
			out.println("break;");
		} else {
			out.println("break " + s.getLabel() + ";");
		}
	}

	private void writeCall(int indent, Stmt.Call s) {
		tab(indent);
		out.print("call ");
		writeAnnotations(s);
		List<LVal> lvals = s.getLVals();
		if (lvals.size() > 0) {
			for (int i = 0; i != lvals.size(); ++i) {
				if (i != 0) {
					out.print(", ");
				}
				writeExpression(lvals.get(i));
			}
			out.print(" := ");
		}
		out.print(s.getName());
		out.print("(");
		boolean firstTime = true;
		for (Expr a : s.getArguments()) {
			if (!firstTime) {
				out.print(", ");
			}
			firstTime = false;
			writeExpression(a);
		}
		out.println(");");
	}

	private void writeHavoc(int indent, Stmt.Havoc s) {
		tab(indent);
		out.print("havoc ");
		List<Expr.VariableAccess> vars = s.getVariables();
		for (int i = 0; i != vars.size(); ++i) {
			if (i != 0) {
				out.print(", ");
			}
			writeExpression(vars.get(i));
		}
		out.println(";");
	}

	private void writeLabel(int indent, Stmt.Label s) {
		tab(indent - 1);
		out.print(s.getLabel());
		out.println(":");
	}

	private void writeIfElse(int indent, Stmt.IfElse s) {
		out.print("if(");
		writeExpression(s.getCondition());
		out.println(") {");
		writeStmt(indent + 1, s.getTrueBranch());
		if (s.getElseIf() != null) {
			tab(indent);
			out.print("} else ");
			writeIfElse(indent, s.getElseIf());
			return;
		} else if (s.getFalseBranch() != null) {
			tab(indent);
			out.println("} else {");
			writeStmt(indent + 1, s.getFalseBranch());
		}
		tab(indent);
		out.println("}");
	}

	private void writeReturn(int indent, Stmt.Return s) {
		tab(indent);
		out.println("return;");
	}

	private void writeSequence(int indent, Stmt.Sequence s) {
		for (int i = 0; i != s.size(); ++i) {
			writeStmt(indent, s.get(i));
		}
	}

	private void writeWhile(int indent, Stmt.While s) {
		tab(indent);
		out.print("while(");
		writeExpression(s.getCondition());
		out.println(")");
		List<Expr.Logical> invariant = s.getInvariant();
		for (int i = 0; i != invariant.size(); ++i) {
			Expr.Logical ith = invariant.get(i);
			tab(indent);
			out.print("invariant ");
			writeAnnotations(ith);
			writeExpression(ith);
			out.println(";");
		}
		tab(indent);
		out.println("{");
		writeStmt(indent + 1, s.getBody());
		tab(indent);
		out.println("}");
	}

	// =========================================================================
	// Expressions
	// =========================================================================

	private void writeExpressionWithBraces(Expr e) {
		if (e instanceof Expr.UnaryOperator || e instanceof Expr.BinaryOperator || e instanceof Expr.NaryOperator) {
			out.print("(");
			writeExpression(e);
			out.print(")");
		} else {
			writeExpression(e);
		}
	}

	private void writeExpression(Expr e) {
		if (e instanceof Expr.DictionaryAccess) {
			writeDictionaryAccess((Expr.DictionaryAccess) e);
		} else if (e instanceof Expr.DictionaryUpdate) {
			writeDictionaryUpdate((Expr.DictionaryUpdate) e);
		} else if (e instanceof Expr.Equals) {
			writeInfix((Expr.BinaryOperator) e, " == ");
		} else if (e instanceof Expr.NotEquals) {
			writeInfix((Expr.BinaryOperator) e, " != ");
		} else if (e instanceof Expr.Iff) {
			writeInfix((Expr.BinaryOperator) e, " <==> ");
		} else if (e instanceof Expr.Implies) {
			writeInfix((Expr.BinaryOperator) e, " ==> ");
		} else if (e instanceof Expr.LessThan) {
			writeInfix((Expr.BinaryOperator) e, " < ");
		} else if (e instanceof Expr.LessThanOrEqual) {
			writeInfix((Expr.BinaryOperator) e, " <= ");
		} else if (e instanceof Expr.GreaterThan) {
			writeInfix((Expr.BinaryOperator) e, " > ");
		} else if (e instanceof Expr.GreaterThanOrEqual) {
			writeInfix((Expr.BinaryOperator) e, " >= ");
		} else if (e instanceof Expr.Addition) {
			writeInfix((Expr.BinaryOperator) e, " + ");
		} else if (e instanceof Expr.Subtraction) {
			writeInfix((Expr.BinaryOperator) e, " - ");
		} else if (e instanceof Expr.Multiplication) {
			writeInfix((Expr.BinaryOperator) e, " * ");
		} else if (e instanceof Expr.Division) {
			writeInfix((Expr.BinaryOperator) e, " / ");
		} else if (e instanceof Expr.IntegerDivision) {
			writeInfix((Expr.BinaryOperator) e, " div ");
		} else if (e instanceof Expr.Remainder) {
			writeInfix((Expr.BinaryOperator) e, " mod ");
		} else if (e instanceof Expr.Boolean) {
			out.print(Boolean.toString(((Expr.Boolean) e).getValue()));
		} else if (e instanceof Expr.BitVectorConstant) {
			Expr.BitVectorConstant bv = (Expr.BitVectorConstant) e;
			out.print(bv.getValue().toString() + "bv" + bv.getWidth());
		} else if (e instanceof Expr.Integer) {
			out.print(((Expr.Integer) e).getValue().toString());
		} else if (e instanceof Expr.LogicalAnd) {
			writeNary(((Expr.LogicalAnd) e).getOperands(), " && ");
		} else if (e instanceof Expr.LogicalOr) {
			writeNary(((Expr.LogicalOr) e).getOperands(), " || ");
		} else if (e instanceof Expr.Quantifier) {
			writeQuantifier((Expr.Quantifier) e);
		} else if (e instanceof Expr.Invoke) {
			writeInvoke((Expr.Invoke) e);
		} else if (e instanceof Expr.IfThenElse) {
			writeIfThenElse((Expr.IfThenElse) e);
		} else if (e instanceof Expr.LogicalNot) {
			out.print("!");
			writeExpressionWithBraces(((Expr.LogicalNot) e).getOperand());
		} else if (e instanceof Expr.Old) {
			out.print("old(");
			writeExpression(((Expr.Old) e).getOperand());
			out.print(")");
		} else if (e instanceof Expr.Negation) {
			out.print("-");
			writeExpressionWithBraces(((Expr.Negation) e).getOperand());
		} else if (e instanceof Expr.VariableAccess) {
			out.print(((Expr.VariableAccess) e).getVariable());
		} else {
			throw new IllegalArgumentException("unknown expression encountered (" + e.getClass().getName() + ")");
		}
	}

	private void writeInfix(Expr.BinaryOperator e, String operator) {
		writeExpressionWithBraces(e.getLeftHandSide());
		out.print(operator);
		writeExpressionWithBraces(e.getRightHandSide());
	}

	private void writeNary(List<? extends Expr> operands, String operator) {
		for (int i = 0; i != operands.size(); ++i) {
			if (i != 0) {
				out.print(operator);
			}
			writeExpressionWithBraces(operands.get(i));
		}
	}

	private void writeIndices(List<Expr> indices) {
		for (int i = 0; i != indices.size(); ++i) {
			if (i != 0) {
				out.print(", ");
			}
			writeExpression(indices.get(i));
		}
	}

	private void writeDictionaryAccess(Expr.DictionaryAccess e) {
		writeExpression(e.getSource());
		out.print("[");
		writeIndices(e.getIndices());
		out.print("]");
	}

	private void writeDictionaryUpdate(Expr.DictionaryUpdate e) {
		writeExpression(e.getSource());
		out.print("[");
		writeIndices(e.getIndices());
		out.print(" := ");
		writeExpression(e.getValue());
		out.print("]");
	}

	private void writeInvoke(Expr.Invoke e) {
		out.print(e.getName());
		out.print("(");
		boolean firstTime = true;
		for (Expr a : e.getArguments()) {
			if (!firstTime) {
				out.print(", ");
			}
			firstTime = false;
			writeExpression(a);
		}
		out.print(")");
	}

	private void writeIfThenElse(Expr.IfThenElse e) {
		out.print("(if ");
		writeExpression(e.getCondition());
		out.print(" then ");
		writeExpression(e.getTrueBranch());
		out.print(" else ");
		writeExpression(e.getFalseBranch());
		out.print(")");
	}

	private void writeQuantifier(Expr.Quantifier e) {
		out.print("(");
		List<Decl.Parameter> params = e.getParameters();
		if (e instanceof Expr.UniversalQuantifier) {
			out.print("forall ");
		} else {
			out.print("exists ");
		}
		for (int i = 0; i != params.size(); ++i) {
			Decl.Parameter ith = params.get(i);
			if (i != 0) {
				out.print(", ");
			}
			out.print(ith.getName());
			out.print(":");
			writeType(ith.getType());
		}
		out.print(" :: ");
		writeExpression(e.getBody());
		out.print(")");
	}

	private void writeType(Type t) {
		if (t instanceof Type.Bool) {
			out.print("bool");
		} else if (t instanceof Type.Int) {
			out.print("int");
		} else if (t instanceof Type.Real) {
			out.print("real");
		} else if (t instanceof Type.Synonym) {
			out.print(((Type.Synonym) t).getSynonym());
		} else if (t instanceof Type.BitVector) {
			out.print("bv" + ((Type.BitVector) t).getDigits());
		} else if (t instanceof Type.Dictionary) {
			Type.Dictionary m = (Type.Dictionary) t;
			out.print("[");
			List<Type> keys = m.getKeys();
			for (int i = 0; i != keys.size(); ++i) {
				if (i != 0) {
					out.print(",");
				}
				writeType(keys.get(i));
			}
			out.print("]");
			writeType(m.getValue());
		} else {
			throw new IllegalArgumentException("unknown type encountered (" + t.getClass().getName() + ")");
		}
	}

	public static String toString(BoogieFile.Expr expr) {
		StringWriter buf = new StringWriter();
		BoogieFilePrinter p = new BoogieFilePrinter(buf);
		p.writeExpression(expr);
		p.flush();
		return buf.toString();
	}

	public static String toString(BoogieFile.Stmt stmt) {
		StringWriter buf = new StringWriter();
		BoogieFilePrinter p = new BoogieFilePrinter(buf);
		p.writeStmt(0, stmt);
		p.flush();
		return buf.toString();
	}

	public static String toString(BoogieFile.Decl decl) {
		StringWriter buf = new StringWriter();
		BoogieFilePrinter p = new BoogieFilePrinter(buf);
		p.write(decl);
		return buf.toString();
	}

	public static String toString(BoogieFile file) {
		StringWriter buf = new StringWriter();
		new BoogieFilePrinter(buf).write(file);
		return buf.toString();
	}
}
