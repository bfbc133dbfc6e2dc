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
import java.util.List;

import org.apache.log4j.Logger;

import gpuverify.core.BoogieFile;
import gpuverify.core.KernelArrayInfo;
import gpuverify.util.AbstractStatementVisitor;
import gpuverify.util.Util;

/**
 * Removes all shared state from a kernel. Reads of shared state become
 * nondeterministic, writes are discarded and the declarations themselves are
 * removed. Race checking remains possible since it only concerns the offsets
 * at which shared state is accessed, not the values stored there.
 */
public class SharedStateAbstractor {
	private final Logger logger;
	private final KernelArrayInfo arrays;
	private final AccessCollector accesses;

	public SharedStateAbstractor(KernelArrayInfo arrays, Logger logger) {
		this.arrays = arrays;
		this.accesses = new AccessCollector(arrays);
		this.logger = logger;
	}

	public void apply(BoogieFile file) {
		List<Decl> declarations = file.getDeclarations();
		for (int i = 0; i != declarations.size(); ++i) {
			Decl d = declarations.get(i);
			if (d instanceof Decl.Variable && arrays.isShared(((Decl.Variable) d).getName())) {
				logger.debug("abstracting shared variable " + ((Decl.Variable) d).getName());
				declarations.remove(i--);
			} else if (d instanceof Decl.Procedure) {
				Decl.Procedure p = (Decl.Procedure) d;
				List<String> modifies = new ArrayList<>();
				for (String m : p.getModifies()) {
					if (!arrays.isShared(m)) {
						modifies.add(m);
					}
				}
				if (modifies.size() != p.getModifies().size()) {
					declarations.set(i, p.withModifies(modifies));
				}
			} else if (d instanceof Decl.Implementation) {
				Decl.Implementation impl = (Decl.Implementation) d;
				Stmt body = new Abstractor().visitStatement(impl.getBody());
				if (body != impl.getBody()) {
					declarations.set(i, impl.withBody(body));
				}
			}
		}
	}

	private class Abstractor extends AbstractStatementVisitor {

		@Override
		protected Stmt constructAssignment(Stmt.Assignment s) {
			LVal lhs = s.getLeftHandSide();
			if (accesses.containsNonLocalAccess(s.getRightHandSide())) {
				return HAVOC(Util.rootOf(lhs));
			} else if (arrays.isShared(Util.rootOf(lhs).getVariable())) {
				return SEQUENCE();
			}
			return s;
		}

		@Override
		protected Stmt constructHavoc(Stmt.Havoc s) {
			List<Expr.VariableAccess> variables = new ArrayList<>();
			for (Expr.VariableAccess v : s.getVariables()) {
				if (!arrays.isShared(v.getVariable())) {
					variables.add(v);
				}
			}
			if (variables.size() == s.getVariables().size()) {
				return s;
			}
			return variables.isEmpty() ? SEQUENCE() : HAVOC(variables, s.getAttributes());
		}
	}
}
