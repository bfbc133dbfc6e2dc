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

import static gpuverify.core.BoogieFile.*;
import static org.junit.jupiter.api.Assertions.assertNotNull;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.apache.log4j.Logger;

import gpuverify.io.BoogieFilePrinter;
import gpuverify.transform.KernelChecker;

/**
 * Helpers for constructing small kernels in tests.
 */
public class KernelFixtures {
	public static final Logger LOGGER = Logger.getLogger(KernelFixtures.class);
	public static final String KERNEL = "foo";
	public static final String BARRIER = "bugle_barrier";

	/**
	 * Declare the special constants for each given dimension.
	 *
	 * @param type
	 * @param axes
	 * @return
	 */
	public static List<Decl> axisConstants(Type type, Kernel.Axis... axes) {
		ArrayList<Decl> result = new ArrayList<>();
		for (Kernel.Axis axis : axes) {
			for (String name : axis.constants()) {
				result.add(CONSTANT(name, type));
			}
		}
		return result;
	}

	/**
	 * Construct a one-dimensional kernel over integers with a given body.
	 *
	 * @param locals
	 * @param body
	 * @param globals Additional declarations, such as shared arrays.
	 * @return
	 */
	public static BoogieFile kernel(List<Decl.Variable> locals, Stmt body, Decl... globals) {
		return kernel(Type.Int, locals, body, globals);
	}

	public static BoogieFile kernel(Type idType, List<Decl.Variable> locals, Stmt body, Decl... globals) {
		BoogieFile file = new BoogieFile();
		file.getDeclarations().addAll(axisConstants(idType, Kernel.Axis.X));
		file.getDeclarations().addAll(Arrays.asList(globals));
		file.getDeclarations().add(PROCEDURE(KERNEL, Collections.emptyList(), Collections.emptyList(), ANNOTATION("kernel")));
		file.getDeclarations().add(PROCEDURE(BARRIER, Collections.emptyList(), Collections.emptyList(), ANNOTATION("barrier")));
		file.getDeclarations().add(IMPLEMENTATION(KERNEL, Collections.emptyList(), Collections.emptyList(), locals, body));
		return file;
	}

	/**
	 * A kernel where each thread writes its own element of a group-shared
	 * array inside a loop, alongside a global array which is never written.
	 *
	 * @return
	 */
	public static BoogieFile loopKernel() {
		Stmt loop = WHILE(LT(VAR("i"), CONST(10)), Collections.emptyList(),
				SEQUENCE(ASSIGN(GET(VAR("A"), VAR("_X")), VAR("i")), ASSIGN(VAR("i"), ADD(VAR("i"), CONST(1)))));
		return kernel(ints("i"), SEQUENCE(ASSIGN(VAR("i"), CONST(0)), loop),
				VARIABLE("A", map(Type.Int, Type.Int), ANNOTATION("group_shared")), VARIABLE("G", map(Type.Int, Type.Int)));
	}

	public static Type.Dictionary map(Type key, Type value) {
		return new Type.Dictionary(key, value);
	}

	public static List<Decl.Variable> ints(String... names) {
		ArrayList<Decl.Variable> result = new ArrayList<>();
		for (String n : names) {
			result.add(VARIABLE(n, Type.Int));
		}
		return result;
	}

	/**
	 * Check a kernel which is expected to be well-formed.
	 *
	 * @param file
	 * @return
	 */
	public static Kernel check(BoogieFile file) {
		KernelChecker checker = new KernelChecker(LOGGER);
		Kernel kernel = checker.check(file);
		assertNotNull(kernel, "unexpected errors " + checker.getErrors());
		return kernel;
	}

	/**
	 * Print something and split the result into lines, stripping indentation
	 * and dropping blank lines.
	 *
	 * @param text
	 * @return
	 */
	public static List<String> lines(String text) {
		ArrayList<String> result = new ArrayList<>();
		for (String line : text.split("\\R")) {
			line = line.trim();
			if (!line.isEmpty()) {
				result.add(line);
			}
		}
		return result;
	}

	public static List<String> lines(Stmt stmt) {
		return lines(BoogieFilePrinter.toString(stmt));
	}

	public static List<String> lines(Decl decl) {
		return lines(BoogieFilePrinter.toString(decl));
	}

	public static List<String> lines(BoogieFile file) {
		return lines(BoogieFilePrinter.toString(file));
	}

	public static List<String> names(List<? extends Decl.Parameter> parameters) {
		ArrayList<String> result = new ArrayList<>();
		for (Decl.Parameter p : parameters) {
			result.add(p.getName());
		}
		return result;
	}

	public static List<String> globals(BoogieFile file) {
		return names(file.getDeclarations(Decl.Variable.class));
	}
}
