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

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;

import gpuverify.core.BoogieFile;
import gpuverify.core.BoogieFile.Decl;
import gpuverify.core.BoogieFile.Expr;
import gpuverify.util.AbstractExpressionFold;
import gpuverify.util.Util;

/**
 * Checks that every identifier used by an expression refers to something
 * declared in a given program. Variables must be globals, constants or else
 * in a supplied local scope, whilst invoked names must be functions.
 */
public class NameResolver {
	private final Set<String> variables = new LinkedHashSet<>();
	private final Set<String> functions = new LinkedHashSet<>();

	public NameResolver(BoogieFile file) {
		for (Decl d : file.getDeclarations()) {
			if (d instanceof Decl.Variable) {
				variables.add(((Decl.Variable) d).getName());
			} else if (d instanceof Decl.Constant) {
				variables.add(((Decl.Constant) d).getName());
			} else if (d instanceof Decl.Function) {
				functions.add(((Decl.Function) d).getName());
			}
		}
	}

	/**
	 * Determine the identifiers of an expression which fail to resolve.
	 *
	 * @param e
	 * @param scope
	 *            Names of the parameters and locals in scope.
	 * @return
	 */
	public Set<String> unresolved(Expr e, Collection<String> scope) {
		Set<String> result = new LinkedHashSet<>();
		for (String v : Util.variablesOf(e)) {
			if (!variables.contains(v) && !scope.contains(v)) {
				result.add(v);
			}
		}
		for (String f : invokedBy(e)) {
			if (!functions.contains(f)) {
				result.add(f);
			}
		}
		return result;
	}

	public boolean resolves(Expr e, Collection<String> scope) {
		return unresolved(e, scope).isEmpty();
	}

	private static Set<String> invokedBy(Expr e) {
		return new AbstractExpressionFold<Set<String>>() {
			@Override
			public Set<String> BOTTOM() {
				return new LinkedHashSet<>();
			}

			@Override
			public Set<String> join(Set<String> lhs, Set<String> rhs) {
				lhs.addAll(rhs);
				return lhs;
			}

			@Override
			protected Set<String> visitInvoke(Expr.Invoke expr) {
				Set<String> r = super.visitInvoke(expr);
				r.add(expr.getName());
				return r;
			}
		}.visitExpression(e);
	}
}
