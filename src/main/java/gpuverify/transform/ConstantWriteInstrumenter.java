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
 * Follows every write into a constant array with
 * <code>assert {:constant_write} false;</code>. Since this runs before
 * predication, the assertion only fails when the write is actually reached.
 * The source location of the most recent <code>{:sourceloc}</code> assertion
 * is copied onto each such assertion so that a failure can be reported
 * against the offending line.
 */
public class ConstantWriteInstrumenter {
	public static final String CONSTANT_WRITE = "constant_write";

	private final Logger logger;
	private final KernelArrayInfo arrays;
	private int count;

	public ConstantWriteInstrumenter(KernelArrayInfo arrays, Logger logger) {
		this.arrays = arrays;
		this.logger = logger;
	}

	public void apply(BoogieFile file) {
		for (Decl.Implementation impl : file.getDeclarations(Decl.Implementation.class)) {
			Stmt body = new Instrumenter().visitStatement(impl.getBody());
			if (body != impl.getBody()) {
				file.replace(impl, impl.withBody(body));
			}
		}
		logger.debug("added " + count + " constant write assertions");
	}

	private class Instrumenter extends AbstractStatementVisitor {
		private Attribute[] sourceLocation = new Attribute[0];

		@Override
		protected Stmt constructAssert(Stmt.Assert s) {
			if (s.hasAnnotation("sourceloc")) {
				sourceLocation = s.getAttributes();
			}
			return s;
		}

		@Override
		protected Stmt constructAssignment(Stmt.Assignment s) {
			ArrayList<Stmt> stmts = new ArrayList<>();
			stmts.add(s);
			for (LVal lhs : s.getLeftHandSides()) {
				Expr.VariableAccess root = Util.rootOf(lhs);
				if (root != null && arrays.isConstant(root.getVariable())) {
					stmts.add(ASSERT(CONST(false), attributes()));
					count++;
				}
			}
			return stmts.size() == 1 ? s : SEQUENCE(stmts);
		}

		private Attribute[] attributes() {
			List<Attribute> attributes = new ArrayList<>();
			attributes.add(ANNOTATION(CONSTANT_WRITE));
			for (Attribute a : sourceLocation) {
				Annotation annotation = a.as(Annotation.class);
				if (annotation == null || !annotation.getName().equals("sourceloc")) {
					attributes.add(a);
				}
			}
			return attributes.toArray(new Attribute[attributes.size()]);
		}
	}
}
