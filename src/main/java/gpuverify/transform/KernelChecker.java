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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.log4j.Logger;

import gpuverify.core.BoogieFile;
import gpuverify.core.BoogieFile.Decl;
import gpuverify.core.BoogieFile.Type;
import gpuverify.core.Kernel;
import gpuverify.core.KernelArrayInfo;

/**
 * Checks that a program follows the conventions expected of a kernel. There
 * must be exactly one procedure annotated <code>{:kernel}</code> and exactly
 * one annotated <code>{:barrier}</code>, neither taking parameters nor
 * returning results. The kernel must declare the special constants for each
 * dimension it uses. Errors are accumulated rather than reported one at a
 * time, so that a user sees every problem with their kernel at once.
 */
public class KernelChecker {
	private final Logger logger;
	private final List<String> errors = new ArrayList<>();

	public KernelChecker(Logger logger) {
		this.logger = logger;
	}

	/**
	 * Get the errors reported by the last call to {@link #check(BoogieFile)}.
	 *
	 * @return
	 */
	public List<String> getErrors() {
		return Collections.unmodifiableList(errors);
	}

	/**
	 * Check a given program, returning the facts established about the kernel
	 * if it is well-formed. Otherwise, <code>null</code> is returned and the
	 * problems can be obtained from {@link #getErrors()}.
	 *
	 * @param file
	 * @return
	 */
	public Kernel check(BoogieFile file) {
		errors.clear();
		Decl.Procedure kernel = checkSingleInstanceOfAnnotatedProcedure(file, "kernel");
		Decl.Procedure barrier = checkSingleInstanceOfAnnotatedProcedure(file, "barrier");
		if (!errors.isEmpty()) {
			return null;
		}
		if (!kernel.getParameters().isEmpty()) {
			error("Kernel should not take any parameters");
		}
		if (!kernel.getReturns().isEmpty()) {
			error("Kernel should not return anything");
		}
		if (!barrier.getParameters().isEmpty()) {
			error("Barrier procedure must not take any arguments");
		}
		if (!barrier.getReturns().isEmpty()) {
			error("Barrier procedure must not return any results");
		}
		if (file.getImplementation(kernel.getName()) == null) {
			error("No implementation of kernel procedure " + kernel.getName());
		}
		Map<String, Type> specials = findSpecialConstants(file);
		checkAxes(specials);
		checkLocalVariables(file);
		if (!errors.isEmpty()) {
			return null;
		}
		return new Kernel(kernel.getName(), barrier.getName(), specials, classifyArrays(file));
	}

	private Decl.Procedure checkSingleInstanceOfAnnotatedProcedure(BoogieFile file, String annotation) {
		Decl.Procedure annotated = null;
		for (Decl d : file.getDeclarations()) {
			if (!d.hasAnnotation(annotation)) {
				continue;
			}
			if (d instanceof Decl.Procedure) {
				Decl.Procedure p = (Decl.Procedure) d;
				if (annotated == null) {
					annotated = p;
				} else {
					error("\"" + annotation + "\" attribute specified for procedure " + p.getName()
							+ ", but it has already been specified for procedure " + annotated.getName());
				}
			} else if (!(d instanceof Decl.Implementation)) {
				error("\"" + annotation + "\" attribute can only be applied to a procedure");
			}
		}
		if (annotated == null) {
			error("\"" + annotation + "\" attribute has not been specified for any procedure.  "
					+ "You must mark exactly one procedure with this attribute");
		}
		return annotated;
	}

	private Map<String, Type> findSpecialConstants(BoogieFile file) {
		List<String> names = new ArrayList<>();
		for (Kernel.Axis axis : Kernel.Axis.values()) {
			names.addAll(axis.constants());
		}
		Map<String, Type> specials = new LinkedHashMap<>();
		for (Decl.Constant c : file.getDeclarations(Decl.Constant.class)) {
			if (names.contains(c.getName())) {
				if (!c.getType().equals(Type.Int) && !c.getType().equals(Type.BitVector32)) {
					error("Special constant '" + c.getName() + "' must have type 'int' or 'bv32'");
				}
				specials.put(c.getName(), c.getType());
			}
		}
		return specials;
	}

	private void checkAxes(Map<String, Type> specials) {
		for (String name : Kernel.Axis.X.constants()) {
			if (!specials.containsKey(name)) {
				error("Kernel must declare global constant '" + name + "'");
			}
		}
		if (declaresAny(specials, Kernel.Axis.Y)) {
			for (String name : Kernel.Axis.Y.constants()) {
				if (!specials.containsKey(name)) {
					error("2D kernel must declare global constant '" + name + "'");
				}
			}
		}
		if (declaresAny(specials, Kernel.Axis.Z)) {
			List<String> required = Kernel.Axis.Y.constants();
			required.addAll(Kernel.Axis.Z.constants());
			for (String name : required) {
				if (!specials.containsKey(name)) {
					error("3D kernel must declare global constant '" + name + "'");
				}
			}
		}
	}

	private static boolean declaresAny(Map<String, Type> specials, Kernel.Axis axis) {
		for (String name : axis.constants()) {
			if (specials.containsKey(name)) {
				return true;
			}
		}
		return false;
	}

	private void checkLocalVariables(BoogieFile file) {
		for (Decl.Implementation impl : file.getDeclarations(Decl.Implementation.class)) {
			for (Decl.Variable v : impl.getLocals()) {
				if (v.hasAnnotation("tile_static") || v.hasAnnotation("group_shared")) {
					error("Local variable '" + v.getName()
							+ "' must not be marked 'tile_static' -- promote the variable to global scope");
				}
			}
		}
	}

	private KernelArrayInfo classifyArrays(BoogieFile file) {
		KernelArrayInfo arrays = new KernelArrayInfo();
		for (Decl.Variable v : file.getDeclarations(Decl.Variable.class)) {
			arrays.add(v);
		}
		return arrays;
	}

	private void error(String message) {
		logger.error(message);
		errors.add(message);
	}
}
