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
import static org.junit.jupiter.api.Assertions.*;

import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import gpuverify.core.BoogieFile;

public class TypeCheckerTest {
	private static final Map<String, Type> SCOPE = Map.of("i", Type.Int, "b", Type.Bool, "v", Type.BitVector32);

	private static TypeChecker checker() {
		BoogieFile file = new BoogieFile();
		file.getDeclarations().add(CONSTANT("_X", Type.Int));
		file.getDeclarations().add(VARIABLE("G", new Type.Dictionary(Type.Int, Type.Bool)));
		file.getDeclarations().add(FUNCTION("BV32_LT", List.of(PARAMETER("x", Type.BitVector32),
				PARAMETER("y", Type.BitVector32)), Type.Bool));
		return checker(file);
	}

	private static TypeChecker checker(BoogieFile file) {
		return new TypeChecker(file);
	}

	@Test
	public void test_well_typed() throws TypeChecker.TypeError {
		TypeChecker checker = checker();
		checker.checkLogical(EQ(VAR("i"), ADD(VAR("_X"), CONST(1))), SCOPE);
		checker.checkLogical(AND(VAR("b"), GET(VAR("G"), VAR("i"))), SCOPE);
		checker.checkLogical(INVOKE("BV32_LT", VAR("v"), VAR("v")), SCOPE);
		checker.checkLogical(FORALL("j", Type.Int, IMPLIES(GTEQ(VAR("j"), CONST(0)), GET(VAR("G"), VAR("j")))), SCOPE);
		assertEquals(Type.Int, checker.typeOf(ITE(VAR("b"), VAR("i"), CONST(0)), SCOPE));
	}

	@Test
	public void test_mismatched_equality() {
		TypeChecker.TypeError e = assertThrows(TypeChecker.TypeError.class,
				() -> checker().checkLogical(EQ(VAR("b"), CONST(0)), SCOPE));
		assertEquals("expected bool, found int", e.getMessage());
	}

	@Test
	public void test_not_boolean() {
		assertThrows(TypeChecker.TypeError.class, () -> checker().checkLogical(VAR("i"), SCOPE));
	}

	@Test
	public void test_bad_index() {
		assertThrows(TypeChecker.TypeError.class, () -> checker().checkLogical(GET(VAR("G"), VAR("b")), SCOPE));
		assertThrows(TypeChecker.TypeError.class, () -> checker().typeOf(GET(VAR("i"), CONST(0)), SCOPE));
	}

	@Test
	public void test_bad_arguments() {
		assertThrows(TypeChecker.TypeError.class,
				() -> checker().checkLogical(INVOKE("BV32_LT", VAR("i"), VAR("v")), SCOPE));
		assertThrows(TypeChecker.TypeError.class,
				() -> checker().checkLogical(INVOKE("BV32_GT", VAR("v"), VAR("v")), SCOPE));
	}

	@Test
	public void test_arithmetic_on_booleans() {
		assertThrows(TypeChecker.TypeError.class, () -> checker().typeOf(ADD(VAR("b"), VAR("b")), SCOPE));
	}

	@Test
	public void test_unknown_variable() {
		assertThrows(TypeChecker.TypeError.class,
				() -> checker().checkLogical(EQ(VAR("zz"), CONST(0)), Collections.emptyMap()));
	}
}
