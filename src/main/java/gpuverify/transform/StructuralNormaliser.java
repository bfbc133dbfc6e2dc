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
package gpuverify.transform;

import static gpuverify.core.BoogieFile.*;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.log4j.Logger;

import gpuverify.core.BoogieFile;
import gpuverify.core.Kernel;
import gpuverify.core.MalformedKernelException;
import gpuverify.util.AbstractExpressionTransform;
import gpuverify.util.AbstractStatementVisitor;
import gpuverify.util.Util;

/**
 * Puts every implementation into the shape expected by the later passes. In
 * particular:
 * <ul>
 * <li><b>Else-if removal.</b> An <code>if</code> with an <code>else if</code>
 * becomes an <code>if</code> whose <code>else</code> branch holds the nested
 * <code>if</code>.</li>
 * <li><b>Start and end barriers.</b> The kernel body begins with a call to the
 * barrier and ends with a block labelled <code>__lastBarrier</code> which calls
 * it again.</li>
 * <li><b>Non-local accesses.</b> Every read of global or group-shared state
 * occurring inside a larger expression is pulled out into an assignment to a
 * fresh temporary <code>_temp&lt;n&gt;</code>. Afterwards, each statement
 * touches shared state at most once.</li>
 * </ul>
 */
public class StructuralNormaliser {
	public static final String LAST_BARRIER = "__lastBarrier";
	public static final String TEMP_PREFIX = "_temp";

	private final Logger logger;
	private final Kernel kernel;
	private final AccessCollector accesses;
	private int temps;

	public StructuralNormaliser(Kernel kernel, Logger logger) {
		this.kernel = kernel;
		this.logger = logger;
		this.accesses = new AccessCollector(kernel.getArrays());
	}

	public void apply(BoogieFile file) {
		for (Decl.Implementation impl : file.getDeclarations(Decl.Implementation.class)) {
			Decl.Implementation n = normalise(impl);
			if (n != impl) {
				file.replace(impl, n);
			}
		}
		logger.debug("normalisation introduced " + temps + " temporaries");
	}

	/**
	 * Normalise a single implementation. If nothing needs to change, the same
	 * implementation object is returned.
	 *
	 * @param impl
	 * @return
	 */
	public Decl.Implementation normalise(Decl.Implementation impl) {
		Stmt body = new ElseIfRemover().visitStatement(impl.getBody());
		ArrayList<Decl.Variable> locals = new ArrayList<>(impl.getLocals());
		body = new AccessExtractor(locals).visitStatement(body);
		if (impl.getName().equals(kernel.getKernelName())) {
			body = addStartAndEndBarriers(body);
		}
		if (body == impl.getBody()) {
			return impl;
		} else if (locals.size() == impl.getLocals().size()) {
			return impl.withBody(body);
		} else {
			return impl.withLocals(locals).withBody(body);
		}
	}

	private Stmt addStartAndEndBarriers(Stmt body) {
		List<Stmt> stmts = new ArrayList<>(Util.flatten(body));
		int start = (!stmts.isEmpty() && stmts.get(0) instanceof Stmt.Label) ? 1 : 0;
		stmts.add(start, barrierCall());
		stmts.add(LABEL(LAST_BARRIER));
		stmts.add(barrierCall());
		return SEQUENCE(stmts, body.getAttributes());
	}

	private Stmt.Call barrierCall() {
		return CALL(kernel.getBarrierName(), Collections.<Expr>emptyList());
	}

	private static class ElseIfRemover extends AbstractStatementVisitor {
		@Override
		protected Stmt constructIfElse(Stmt.IfElse s, Stmt trueBranch, Stmt elseIf, Stmt falseBranch) {
			if (elseIf != null) {
				return IFELSE(s.getCondition(), trueBranch, SEQUENCE(elseIf), s.getAttributes());
			}
			return super.constructIfElse(s, trueBranch, elseIf, falseBranch);
		}
	}

	/**
	 * Pulls non-local accesses out of statements, leftmost and innermost
	 * first. Also checks that every <code>break</code> is inside a loop.
	 */
	private class AccessExtractor extends AbstractStatementVisitor {
		private final List<Decl.Variable> locals;
		private int loopDepth;

		public AccessExtractor(List<Decl.Variable> locals) {
			this.locals = locals;
		}

		@Override
		protected Stmt visitWhile(Stmt.While s) {
			ArrayList<Stmt> prefix = new ArrayList<>();
			Expr.Logical condition = extract(s.getCondition(), prefix);
			loopDepth++;
			Stmt body = visitStatement(s.getBody());
			loopDepth--;
			if (prefix.isEmpty()) {
				return constructWhile(s, body);
			}
			// guard temporaries are refreshed before each subsequent test
			body = SEQUENCE(Util.append(Util.flatten(body), prefix));
			prefix.add(WHILE(condition, s.getInvariant(), body, s.getAttributes()));
			return SEQUENCE(prefix);
		}

		@Override
		protected Stmt visitIfElse(Stmt.IfElse s) {
			ArrayList<Stmt> prefix = new ArrayList<>();
			Expr.Logical condition = extract(s.getCondition(), prefix);
			Stmt.IfElse r = (Stmt.IfElse) super.visitIfElse(s);
			if (prefix.isEmpty()) {
				return r;
			} else if (r.getElseIf() != null) {
				prefix.add(IFELSEIF(condition, r.getTrueBranch(), r.getElseIf(), r.getAttributes()));
			} else {
				prefix.add(IFELSE(condition, r.getTrueBranch(), r.getFalseBranch(), r.getAttributes()));
			}
			return SEQUENCE(prefix);
		}

		@Override
		protected Stmt constructBreak(Stmt.Break s) {
			if (loopDepth == 0) {
				throw new MalformedKernelException("break statement must occur within a loop");
			}
			return s;
		}

		@Override
		protected Stmt constructAssert(Stmt.Assert s) {
			ArrayList<Stmt> prefix = new ArrayList<>();
			Expr.Logical condition = extract(s.getCondition(), prefix);
			return prefix.isEmpty() ? s : prepend(prefix, ASSERT(condition, s.getAttributes()));
		}

		@Override
		protected Stmt constructAssume(Stmt.Assume s) {
			ArrayList<Stmt> prefix = new ArrayList<>();
			Expr.Logical condition = extract(s.getCondition(), prefix);
			return prefix.isEmpty() ? s : prepend(prefix, ASSUME(condition, s.getAttributes()));
		}

		@Override
		protected Stmt constructCall(Stmt.Call s) {
			ArrayList<Stmt> prefix = new ArrayList<>();
			ArrayList<Expr> arguments = new ArrayList<>();
			for (Expr arg : s.getArguments()) {
				arguments.add(extract(arg, prefix));
			}
			return prefix.isEmpty() ? s : prepend(prefix, CALL(s.getName(), s.getLVals(), arguments, s.getAttributes()));
		}

		@Override
		protected Stmt constructAssignment(Stmt.Assignment s) {
			if (s.size() != 1) {
				for (Expr e : Util.append(s.getLeftHandSides(), s.getRightHandSides())) {
					if (accesses.containsNonLocalAccess(e)) {
						throw new MalformedKernelException("parallel assignment to or from shared state not supported in kernels");
					}
				}
				return s;
			}
			ArrayList<Stmt> prefix = new ArrayList<>();
			LVal lhs = s.getLeftHandSide();
			Expr rhs = s.getRightHandSide();
			boolean sharedWrite = accesses.isNonLocalAccess(lhs);
			if (sharedWrite) {
				// rejects multidimensional maps
				accesses.typeOf(lhs);
			}
			lhs = extractIndices(lhs, prefix);
			if (!accesses.containsNonLocalAccess(rhs)) {
				// nothing to do
			} else if (!sharedWrite && accesses.isNonLocalAccess(rhs)) {
				accesses.typeOf(rhs);
			} else {
				rhs = extract(rhs, prefix);
			}
			if (lhs == s.getLeftHandSide() && rhs == s.getRightHandSide()) {
				return s;
			}
			return prepend(prefix, ASSIGN(lhs, rhs, s.getAttributes()));
		}

		private LVal extractIndices(LVal lhs, List<Stmt> prefix) {
			if (lhs instanceof Expr.DictionaryAccess) {
				Expr.DictionaryAccess a = (Expr.DictionaryAccess) lhs;
				LVal source = extractIndices((LVal) a.getSource(), prefix);
				ArrayList<Expr> indices = new ArrayList<>();
				boolean changed = source != a.getSource();
				for (Expr index : a.getIndices()) {
					Expr n = extract(index, prefix);
					changed |= (n != index);
					indices.add(n);
				}
				return changed ? GET(source, indices, a.getAttributes()) : lhs;
			}
			return lhs;
		}

		private Stmt prepend(List<Stmt> prefix, Stmt s) {
			return SEQUENCE(Util.append(prefix, s));
		}

		private Expr.Logical extract(Expr.Logical e, List<Stmt> prefix) {
			return (Expr.Logical) extract((Expr) e, prefix);
		}

		private Expr extract(Expr e, List<Stmt> prefix) {
			for (Expr access = accesses.findFirst(e); access != null; access = accesses.findFirst(e)) {
				String name = TEMP_PREFIX + (temps++);
				locals.add(VARIABLE(name, accesses.typeOf(access)));
				prefix.add(ASSIGN(VAR(name), access));
				e = substitute(e, access, VAR(name));
			}
			return e;
		}
	}

	private static Expr substitute(Expr e, Expr target, Expr replacement) {
		return new AbstractExpressionTransform() {
			@Override
			public Expr visitExpression(Expr expr) {
				return expr == target ? replacement : super.visitExpression(expr);
			}
		}.visitExpression(e);
	}
}
