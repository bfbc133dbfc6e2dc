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
package gpuverify.util;

import static gpuverify.core.BoogieFile.*;

import java.util.ArrayList;
import java.util.List;

/**
 * Walks a statement tree, rebuilding only those parts which change. A
 * subclass overrides the <code>construct</code> method for the kind of
 * statement it rewrites. A rewrite may return a {@link Stmt.Sequence} in place
 * of a single statement, and it is spliced into the enclosing sequence.
 */
public class AbstractStatementVisitor {

	public Stmt visitStatement(Stmt s) {
		if (s instanceof Stmt.Assignment) {
			return constructAssignment((Stmt.Assignment) s);
		} else if (s instanceof Stmt.Assert) {
			return constructAssert((Stmt.Assert) s);
		} else if (s instanceof Stmt.Assume) {
			return constructAssume((Stmt.Assume) s);
		} else if (s instanceof Stmt.Break) {
			return constructBreak((Stmt.Break) s);
		} else if (s instanceof Stmt.Call) {
			return constructCall((Stmt.Call) s);
		} else if (s instanceof Stmt.Havoc) {
			return constructHavoc((Stmt.Havoc) s);
		} else if (s instanceof Stmt.Label) {
			return constructLabel((Stmt.Label) s);
		} else if (s instanceof Stmt.IfElse) {
			return visitIfElse((Stmt.IfElse) s);
		} else if (s instanceof Stmt.Return) {
			return constructReturn((Stmt.Return) s);
		} else if (s instanceof Stmt.Sequence) {
			return visitSequence((Stmt.Sequence) s);
		} else if (s instanceof Stmt.While) {
			return visitWhile((Stmt.While) s);
		} else {
			throw new IllegalArgumentException("unknown statement encountered (" + s.getClass().getName() + ")");
		}
	}

	protected Stmt visitSequence(Stmt.Sequence s) {
		List<Stmt> oldStmts = s.getAll();
		List<Stmt> newStmts = oldStmts;
		for (int i = 0; i != oldStmts.size(); ++i) {
			Stmt o = oldStmts.get(i);
			Stmt n = visitStatement(o);
			if (o != n && newStmts == oldStmts) {
				newStmts = new ArrayList<>(oldStmts.subList(0, i));
			}
			if (newStmts != oldStmts) {
				if (n instanceof Stmt.Sequence) {
					newStmts.addAll(((Stmt.Sequence) n).getAll());
				} else {
					newStmts.add(n);
				}
			}
		}
		return constructSequence(s, newStmts);
	}

	protected Stmt visitIfElse(Stmt.IfElse s) {
		Stmt trueBranch = visitStatement(s.getTrueBranch());
		Stmt elseIf = s.getElseIf();
		if (elseIf != null) {
			elseIf = visitStatement(elseIf);
		}
		Stmt falseBranch = s.getFalseBranch();
		if (falseBranch != null) {
			falseBranch = visitStatement(falseBranch);
		}
		return constructIfElse(s, trueBranch, elseIf, falseBranch);
	}

	protected Stmt visitWhile(Stmt.While s) {
		Stmt body = visitStatement(s.getBody());
		return constructWhile(s, body);
	}

	protected Stmt constructAssignment(Stmt.Assignment s) {
		return s;
	}

	protected Stmt constructAssert(Stmt.Assert s) {
		return s;
	}

	protected Stmt constructAssume(Stmt.Assume s) {
		return s;
	}

	protected Stmt constructBreak(Stmt.Break s) {
		return s;
	}

	protected Stmt constructCall(Stmt.Call s) {
		return s;
	}

	protected Stmt constructIfElse(Stmt.IfElse s, Stmt trueBranch, Stmt elseIf, Stmt falseBranch) {
		if (s.getTrueBranch() == trueBranch && s.getElseIf() == elseIf && s.getFalseBranch() == falseBranch) {
			return s;
		} else if (elseIf instanceof Stmt.IfElse) {
			return IFELSEIF(s.getCondition(), trueBranch, (Stmt.IfElse) elseIf, s.getAttributes());
		} else {
			// an else-if branch rewritten into something other than an if becomes an else
			return IFELSE(s.getCondition(), trueBranch, elseIf != null ? elseIf : falseBranch, s.getAttributes());
		}
	}

	protected Stmt constructHavoc(Stmt.Havoc s) {
		return s;
	}

	protected Stmt constructLabel(Stmt.Label s) {
		return s;
	}

	protected Stmt constructReturn(Stmt.Return s) {
		return s;
	}

	protected Stmt constructSequence(Stmt.Sequence s, List<Stmt> stmts) {
		if (s.getAll() == stmts) {
			return s;
		} else {
			return SEQUENCE(stmts, s.getAttributes());
		}
	}

	protected Stmt constructWhile(Stmt.While s, Stmt body) {
		if (s.getBody() == body) {
			return s;
		} else {
			return WHILE(s.getCondition(), s.getInvariant(), body, s.getAttributes());
		}
	}
}
