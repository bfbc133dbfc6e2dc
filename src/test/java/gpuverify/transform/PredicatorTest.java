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
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.Test;

import gpuverify.core.BoogieFile;
import gpuverify.util.AbstractExpressionTransform;
import gpuverify.util.Util;

public class PredicatorTest {

	private static Decl.Implementation predicateKernel(List<Decl.Variable> locals, Stmt body) {
		BoogieFile file = kernel(locals, body);
		return new Predicator(check(file), LOGGER).predicate(file.getImplementation(KERNEL), Collections.emptyMap());
	}

	private static Decl.Implementation predicateHelper(Stmt body) {
		Predicator predicator = new Predicator(check(kernel(Collections.emptyList(), SEQUENCE())), LOGGER);
		return predicator.predicate(
				IMPLEMENTATION("h", Collections.emptyList(), Collections.emptyList(), ints("x", "y"), body),
				Collections.emptyMap());
	}

	@Test
	public void test_kernel_loop() {
		Decl.Implementation impl = predicateKernel(ints("c"), SEQUENCE(WHILE(GT(VAR("c"), CONST(0)),
				Collections.emptyList(), SEQUENCE(ASSIGN(VAR("c"), SUB(VAR("c"), CONST(1)))))));
		assertEquals(List.of("_LC0 := true && (c > 0);", "while(_LC0)", "{", "c := (if _LC0 then c - 1 else c);",
				"update__LC0:", "_LC0 := _LC0 && (c > 0);", "}"), lines(impl.getBody()));
		assertEquals(List.of("c", "_LC0"), names(impl.getLocals()));
		assertTrue(impl.getParameters().isEmpty());
	}

	@Test
	public void test_helper() {
		Decl.Implementation impl = predicateHelper(SEQUENCE(ASSIGN(VAR("x"), CONST(1)), HAVOC(VAR("y")),
				ASSERT(GT(VAR("x"), CONST(0)))));
		assertEquals(List.of("_P"), names(impl.getParameters()));
		assertEquals(List.of("x := (if _P then 1 else x);", "havoc _HAVOC_int;", "y := (if _P then _HAVOC_int else y);",
				"assert _P ==> (x > 0);"), lines(impl.getBody()));
		assertEquals(List.of("x", "y", "_HAVOC_int"), names(impl.getLocals()));
	}

	@Test
	public void test_disabled_predicate() {
		Decl.Implementation impl = predicateHelper(SEQUENCE(ASSIGN(VAR("x"), CONST(1)), HAVOC(VAR("y"))));
		// bind the incoming predicate to false
		AbstractExpressionTransform bind = new AbstractExpressionTransform() {
			@Override
			protected Expr visitVariableAccess(Expr.VariableAccess expr) {
				return expr.getVariable().equals(Predicator.PREDICATE) ? CONST(false) : expr;
			}
		};
		List<String> bound = new ArrayList<>();
		for (Stmt s : Util.flatten(impl.getBody())) {
			if (s instanceof Stmt.Assignment) {
				Stmt.Assignment a = (Stmt.Assignment) s;
				Expr.IfThenElse rhs = (Expr.IfThenElse) bind.visitExpression(a.getRightHandSide());
				assertTrue(rhs.getCondition().isFalse());
				assertEquals(lines(ASSIGN(a.getLeftHandSide(), a.getLeftHandSide())).get(0),
						lines(ASSIGN(a.getLeftHandSide(), rhs.getFalseBranch())).get(0));
				bound.add(lines(ASSIGN(a.getLeftHandSide(), rhs)).get(0));
			}
		}
		assertEquals(List.of("x := (if false then 1 else x);", "y := (if false then _HAVOC_int else y);"), bound);
	}

	@Test
	public void test_kernel_if_else() {
		Decl.Implementation impl = predicateKernel(ints("x", "y"), IFELSE(GT(VAR("x"), CONST(0)),
				ASSIGN(VAR("y"), CONST(1)), ASSIGN(VAR("y"), CONST(2))));
		assertEquals(List.of("_P0 := x > 0;", "y := (if true && _P0 then 1 else y);",
				"y := (if true && (!_P0) then 2 else y);"), lines(impl.getBody()));
		assertEquals(List.of("x", "y", "_P0"), names(impl.getLocals()));
	}

	@Test
	public void test_break() {
		Decl.Implementation impl = predicateKernel(List.of(VARIABLE("b", Type.Bool)),
				WHILE(VAR("b"), Collections.emptyList(), SEQUENCE(BREAK())));
		assertEquals(List.of("_LC0 := true && b;", "while(_LC0)", "{", "_LC0 := (if _LC0 then false else _LC0);",
				"update__LC0:", "_LC0 := _LC0 && b;", "}"), lines(impl.getBody()));
	}

	@Test
	public void test_calls_pass_predicate() {
		Decl.Implementation impl = predicateKernel(ints("x"), SEQUENCE(CALL("h", List.of(VAR("x")))));
		assertEquals(List.of("call h(true, x);"), lines(impl.getBody()));
	}

	@Test
	public void test_return_under_predicate() {
		assertThrows(IllegalStateException.class, () -> predicateHelper(SEQUENCE(RETURN())));
	}

	@Test
	public void test_counters_per_implementation() {
		Stmt body = IFELSE(VAR("b"), ASSIGN(VAR("x"), CONST(1)), null);
		Predicator predicator = new Predicator(check(kernel(Collections.emptyList(), SEQUENCE())), LOGGER);
		List<Decl.Variable> locals = Collections.singletonList(VARIABLE("x", Type.Int));
		Decl.Implementation f = predicator.predicate(
				IMPLEMENTATION("f", List.of(PARAMETER("b", Type.Bool)), Collections.emptyList(), locals, body),
				Collections.emptyMap());
		Decl.Implementation g = predicator.predicate(
				IMPLEMENTATION("g", List.of(PARAMETER("b", Type.Bool)), Collections.emptyList(), locals, body),
				Collections.emptyMap());
		assertEquals(List.of("x", "_P0"), names(f.getLocals()));
		assertEquals(List.of("x", "_P0"), names(g.getLocals()));
		assertEquals(List.of("_P0 := b;", "x := (if _P && _P0 then 1 else x);"), lines(g.getBody()));
	}

	@Test
	public void test_apply_adds_predicate_parameter() {
		BoogieFile file = kernel(Collections.emptyList(), SEQUENCE());
		new Predicator(check(file), LOGGER).apply(file);
		assertEquals(List.of("_P"), names(file.getProcedure(BARRIER).getParameters()));
		assertTrue(file.getProcedure(KERNEL).getParameters().isEmpty());
	}
}
