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
import static gpuverify.core.KernelFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.Test;

import gpuverify.core.BoogieFile;
import gpuverify.core.Kernel;
import gpuverify.core.VariableKind;

public class KernelCheckerTest {

	private static List<String> errors(BoogieFile file) {
		KernelChecker checker = new KernelChecker(LOGGER);
		Kernel kernel = checker.check(file);
		assertNull(kernel);
		return checker.getErrors();
	}

	@Test
	public void test_well_formed() {
		BoogieFile file = kernel(Collections.emptyList(), SEQUENCE(),
				VARIABLE("A", map(Type.Int, Type.Int), ANNOTATION("group_shared")),
				VARIABLE("B", map(Type.Int, Type.Int), ANNOTATION("global")));
		KernelChecker checker = new KernelChecker(LOGGER);
		Kernel kernel = checker.check(file);
		assertNotNull(kernel);
		assertTrue(checker.getErrors().isEmpty());
		assertEquals(VariableKind.GROUP_SHARED, kernel.getArrays().kindOf("A"));
		assertEquals(VariableKind.GLOBAL, kernel.getArrays().kindOf("B"));
	}

	@Test
	public void test_two_kernels() {
		BoogieFile file = kernel(Collections.emptyList(), SEQUENCE());
		file.getDeclarations().add(PROCEDURE("bar", Collections.emptyList(), Collections.emptyList(), ANNOTATION("kernel")));
		assertEquals(List.of("\"kernel\" attribute specified for procedure bar, "
				+ "but it has already been specified for procedure foo"), errors(file));
	}

	@Test
	public void test_no_barrier() {
		BoogieFile file = kernel(Collections.emptyList(), SEQUENCE());
		file.getDeclarations().removeIf(d -> d instanceof Decl.Procedure && ((Decl.Procedure) d).getName().equals(BARRIER));
		List<String> errors = errors(file);
		assertEquals(1, errors.size());
		assertTrue(errors.get(0).startsWith("\"barrier\" attribute has not been specified for any procedure."));
	}

	@Test
	public void test_missing_y_group_size() {
		BoogieFile file = kernel(Collections.emptyList(), SEQUENCE(), CONSTANT("_Y", Type.Int),
				CONSTANT("_NUM_TILES_Y", Type.Int), CONSTANT("_TILE_Y", Type.Int));
		assertEquals(List.of("2D kernel must declare global constant '_TILE_SIZE_Y'"), errors(file));
	}

	@Test
	public void test_missing_x_constant() {
		BoogieFile file = kernel(Collections.emptyList(), SEQUENCE());
		file.getDeclarations().removeIf(d -> d instanceof Decl.Constant && ((Decl.Constant) d).getName().equals("_TILE_X"));
		assertEquals(List.of("Kernel must declare global constant '_TILE_X'"), errors(file));
	}

	@Test
	public void test_kernel_parameters() {
		BoogieFile file = kernel(Collections.emptyList(), SEQUENCE());
		List<Decl> decls = file.getDeclarations();
		for (int i = 0; i != decls.size(); ++i) {
			if (decls.get(i) instanceof Decl.Procedure && decls.get(i).hasAnnotation("kernel")) {
				decls.set(i, PROCEDURE(KERNEL, List.of(PARAMETER("n", Type.Int)), Collections.emptyList(),
						ANNOTATION("kernel")));
			}
		}
		assertEquals(List.of("Kernel should not take any parameters"), errors(file));
	}

	@Test
	public void test_tile_static_local() {
		BoogieFile file = kernel(List.of(VARIABLE("t", map(Type.Int, Type.Int), ANNOTATION("tile_static"))), SEQUENCE());
		assertEquals(List.of("Local variable 't' must not be marked 'tile_static' -- promote the variable to global scope"),
				errors(file));
	}

	@Test
	public void test_bool_special_constant() {
		BoogieFile file = kernel(Collections.emptyList(), SEQUENCE());
		List<Decl> decls = file.getDeclarations();
		for (int i = 0; i != decls.size(); ++i) {
			if (decls.get(i) instanceof Decl.Constant && ((Decl.Constant) decls.get(i)).getName().equals("_X")) {
				decls.set(i, CONSTANT("_X", Type.Bool));
			}
		}
		assertEquals(List.of("Special constant '_X' must have type 'int' or 'bv32'"), errors(file));
	}

	@Test
	public void test_errors_reset() {
		KernelChecker checker = new KernelChecker(LOGGER);
		BoogieFile bad = kernel(Collections.emptyList(), SEQUENCE());
		bad.getDeclarations().add(PROCEDURE("bar", Collections.emptyList(), Collections.emptyList(), ANNOTATION("kernel")));
		assertNull(checker.check(bad));
		assertNotNull(checker.check(kernel(Collections.emptyList(), SEQUENCE())));
		assertTrue(checker.getErrors().isEmpty());
	}
}
