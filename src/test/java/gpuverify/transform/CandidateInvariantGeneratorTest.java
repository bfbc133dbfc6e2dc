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

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import gpuverify.core.BoogieFile;
import gpuverify.tasks.KernelTransformTask;
import gpuverify.tasks.TransformResult;

public class CandidateInvariantGeneratorTest {

	/**
	 * Parses comparisons of the form <code>x == y</code> or
	 * <code>x &gt;= y</code> between variables and integer constants.
	 *
	 * @param text
	 * @return
	 * @throws ExpressionParser.SyntaxError
	 */
	private static Expr.Logical parse(String text) throws ExpressionParser.SyntaxError {
		for (String op : new String[] { "==", ">=" }) {
			int i = text.indexOf(op);
			if (i >= 0) {
				Expr lhs = operand(text.substring(0, i));
				Expr rhs = operand(text.substring(i + op.length()));
				return op.equals("==") ? EQ(lhs, rhs) : GTEQ(lhs, rhs);
			}
		}
		throw new ExpressionParser.SyntaxError("expected comparison");
	}

	private static Expr operand(String text) throws ExpressionParser.SyntaxError {
		text = text.trim();
		if (text.isEmpty()) {
			throw new ExpressionParser.SyntaxError("missing operand");
		} else if (text.matches("[0-9]+")) {
			return CONST(Integer.parseInt(text));
		} else {
			return VAR(text);
		}
	}

	private static List<String> invariants(BoogieFile file) {
		List<String> result = new ArrayList<>();
		for (String line : lines(file.getImplementation(KERNEL))) {
			if (line.startsWith("invariant ")) {
				result.add(line);
			}
		}
		return result;
	}

	private static TransformResult run(KernelTransformTask task) {
		TransformResult result = task.run(loopKernel());
		assertTrue(result.isSuccess(), () -> "unexpected failure " + result.getDiagnostics());
		return result;
	}

	@Test
	public void test_loop_candidates() {
		BoogieFile file = run(new KernelTransformTask(LOGGER)).getFile();
		assertEquals(List.of("invariant _b0 ==> (_LC0$1 == _LC0$2);", "invariant _b1 ==> (i$1 == i$2);",
				"invariant _b2 ==> (G$1 == G$2);", "invariant _b3 ==> (!_READ_HAS_OCCURRED_A$1);",
				"invariant _b4 ==> (!_WRITE_HAS_OCCURRED_A$1);",
				"invariant _b5 ==> (_WRITE_HAS_OCCURRED_A$1 ==> (_WRITE_OFFSET_X_A$1 == _X$1));",
				"invariant _b6 ==> (_READ_HAS_OCCURRED_A$1 ==> (_READ_OFFSET_X_A$1 == _X$1));"), invariants(file));
		List<Decl.Constant> constants = file.getDeclarations(Decl.Constant.class);
		assertEquals(List.of("const {:existential true} _b6 : bool;"), lines(constants.get(constants.size() - 1)));
	}

	@Test
	public void test_no_inference() {
		BoogieFile file = run(new KernelTransformTask(LOGGER).setInference(false)).getFile();
		assertTrue(invariants(file).isEmpty());
		for (Decl.Constant c : file.getDeclarations(Decl.Constant.class)) {
			assertFalse(c.hasAnnotation("existential"));
		}
	}

	@Test
	public void test_full_abstraction_candidates() {
		BoogieFile file = run(new KernelTransformTask(LOGGER).setFullAbstraction(true)).getFile();
		assertEquals(6, invariants(file).size());
		assertFalse(lines(file).contains("var G$1 : [int]int;"));
	}

	@Test
	public void test_user_candidates() {
		List<String> user = List.of("i$1 == i$2", "i$1 ==", "", "zz$1 == 0", "i$1 >= 0");
		TransformResult result = run(new KernelTransformTask(LOGGER)
				.setExpressionParser(CandidateInvariantGeneratorTest::parse)
				.setUserSuppliedInvariants("invariants.txt", user));
		assertEquals(List.of("Ignoring badly formed candidate invariant 'i$1 ==' at 'invariants.txt' line 2",
				"Ignoring candidate invariant 'zz$1 == 0' at 'invariants.txt' line 4, which is not valid at any loop or procedure"),
				result.getDiagnostics());
		List<String> invariants = invariants(result.getFile());
		assertEquals(9, invariants.size());
		assertEquals("invariant _b7 ==> (i$1 == i$2);", invariants.get(7));
		assertEquals("invariant _b8 ==> (i$1 >= 0);", invariants.get(8));
		for (String line : lines(result.getFile())) {
			assertFalse(line.contains("zz$1"));
		}
	}

	@Test
	public void test_ill_typed_user_candidate() {
		List<String> user = List.of("_LC0$1 == 0", "_LC0$1 == _LC0$2");
		TransformResult result = run(new KernelTransformTask(LOGGER)
				.setExpressionParser(CandidateInvariantGeneratorTest::parse)
				.setUserSuppliedInvariants("invariants.txt", user));
		assertEquals(List.of("Ignoring candidate invariant '_LC0$1 == 0' at 'invariants.txt' line 1, which is not valid at any loop or procedure"),
				result.getDiagnostics());
		List<String> invariants = invariants(result.getFile());
		assertEquals(8, invariants.size());
		assertEquals("invariant _b7 ==> (_LC0$1 == _LC0$2);", invariants.get(7));
		for (String line : invariants) {
			assertFalse(line.contains("== 0)"), line);
		}
	}

	@Test
	public void test_user_candidates_need_parser() {
		TransformResult result = new KernelTransformTask(LOGGER)
				.setUserSuppliedInvariants("invariants.txt", List.of("i$1 == i$2")).run(loopKernel());
		assertEquals(TransformResult.Outcome.INTERNAL_ERROR, result.getOutcome());
	}

	@Test
	public void test_contract_candidates() {
		// a non-inlined helper called from the kernel
		BoogieFile input = loopKernel();
		input.getDeclarations().add(PROCEDURE("h", List.of(PARAMETER("a", Type.Int)), List.of(PARAMETER("r", Type.Int))));
		input.getDeclarations().add(IMPLEMENTATION("h", List.of(PARAMETER("a", Type.Int)),
				List.of(PARAMETER("r", Type.Int)), List.of(), SEQUENCE(ASSIGN(VAR("r"), VAR("a")))));
		TransformResult result = new KernelTransformTask(LOGGER).setRaceCheckingContract(true).run(input);
		assertTrue(result.isSuccess(), () -> "unexpected failure " + result.getDiagnostics());
		assertEquals(List.of("procedure h(_P$1 : bool, a$1 : int, _P$2 : bool, a$2 : int) returns (r$1 : int, r$2 : int);",
				"requires _b7 ==> (_P$1 == _P$2);", "requires _b8 ==> ((_P$1 && _P$2) ==> (a$1 == a$2));",
				"requires _b9 ==> (a$1 == a$2);", "requires _b11 ==> (!_READ_HAS_OCCURRED_A$1);",
				"requires _b12 ==> (!_WRITE_HAS_OCCURRED_A$1);", "ensures _b10 ==> (r$1 == r$2);",
				"ensures _b13 ==> (!_READ_HAS_OCCURRED_A$1);", "ensures _b14 ==> (!_WRITE_HAS_OCCURRED_A$1);"),
				lines(result.getFile().getProcedure("h")));
	}

	@ParameterizedTest
	@CsvSource({ "_P, true", "_P0, true", "_LC, false", "_LC1, true", "_temp, false", "_temp3, true", "i, false",
			"x_P, false" })
	public void test_predicate_or_temp(String name, boolean expected) {
		assertEquals(expected, CandidateInvariantGenerator.isPredicateOrTemp(name));
	}
}
