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
package gpuverify.tasks;

import static gpuverify.core.BoogieFile.*;
import static gpuverify.core.KernelFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.Test;

import gpuverify.core.BoogieFile;
import gpuverify.io.BoogieFilePrinter;

public class KernelTransformTaskTest {

	private static BoogieFile transform(KernelTransformTask task) {
		TransformResult result = task.run(loopKernel());
		assertTrue(result.isSuccess(), () -> "unexpected failure " + result.getDiagnostics());
		assertEquals(ToolExitCode.SUCCESS, result.getExitCode());
		return result.getFile();
	}

	@Test
	public void test_invalid_logger() {
		assertThrows(IllegalArgumentException.class, () -> new KernelTransformTask(null));
	}

	@Test
	public void test_default_pipeline() {
		List<String> lines = lines(transform(new KernelTransformTask(LOGGER)));
		assertTrue(lines.contains("var {:group_shared} A : [bool][int]int;"));
		assertTrue(lines.contains("call bugle_barrier(true, true);"));
		assertTrue(lines.contains("_LC0$1, _LC0$2 := true && (i$1 < 10), true && (i$2 < 10);"));
		assertTrue(lines.contains("while(_LC0$1 || _LC0$2)"));
		assertTrue(lines.contains("call _LOG_WRITE_A(_LC0$1, _X$1, _LC0$2, _X$2);"));
		assertTrue(lines.contains("A[true][_X$1] := (if _LC0$1 then i$1 else A[true][_X$1]);"));
		assertTrue(lines.contains("__lastBarrier:"));
		assertTrue(lines.contains("requires _TILE_SIZE_X > 0;"));
		assertTrue(lines.contains("requires !_READ_HAS_OCCURRED_A$1;"));
		assertTrue(lines.contains("invariant _b1 ==> (i$1 == i$2);"));
		assertTrue(lines.contains("const {:existential true} _b0 : bool;"));
	}

	@Test
	public void test_input_unchanged() {
		BoogieFile input = loopKernel();
		String before = BoogieFilePrinter.toString(input);
		new KernelTransformTask(LOGGER).run(input);
		assertEquals(before, BoogieFilePrinter.toString(input));
	}

	@Test
	public void test_two_kernels() {
		BoogieFile input = loopKernel();
		input.getDeclarations().add(PROCEDURE("bar", Collections.emptyList(), Collections.emptyList(), ANNOTATION("kernel")));
		TransformResult result = new KernelTransformTask(LOGGER).run(input);
		assertEquals(TransformResult.Outcome.WELL_FORMEDNESS_ERROR, result.getOutcome());
		assertEquals(ToolExitCode.OTHER_ERROR, result.getExitCode());
		assertEquals(2, result.getExitCode().getCode());
		assertNull(result.getFile());
		assertEquals(1, result.getDiagnostics().size());
	}

	@Test
	public void test_malformed_input() {
		Decl.Variable m = VARIABLE("M", new Type.Dictionary(List.of(Type.Int, Type.Int), Type.Int));
		BoogieFile input = kernel(ints("x"),
				SEQUENCE(ASSIGN(VAR("x"), ADD(GET(VAR("M"), List.of(CONST(1), CONST(2))), CONST(1)))), m);
		TransformResult result = new KernelTransformTask(LOGGER).run(input);
		assertEquals(TransformResult.Outcome.MALFORMED_INPUT, result.getOutcome());
		assertEquals(ToolExitCode.OTHER_ERROR, result.getExitCode());
		assertEquals(List.of("multidimensional maps not supported in kernels, use nested maps instead"),
				result.getDiagnostics());
	}

	@Test
	public void test_atomic_used_map() {
		Decl.Variable u = VARIABLE("U", map(Type.Int, map(Type.Int, Type.Int)), ANNOTATION("atomic_usedmap"));
		BoogieFile input = kernel(ints("x"), SEQUENCE(ASSIGN(VAR("x"), GET(GET(VAR("U"), CONST(0)), CONST(1)))), u);
		TransformResult result = new KernelTransformTask(LOGGER).run(input);
		assertTrue(result.isSuccess(), () -> "unexpected failure " + result.getDiagnostics());
		List<String> lines = lines(result.getFile());
		assertTrue(lines.contains("var {:atomic_usedmap} U$1 : [int][int]int;"));
		assertTrue(lines.contains("var {:atomic_usedmap} U$2 : [int][int]int;"));
		assertTrue(lines.contains("x$1, x$2 := U$1[0][1], U$2[0][1];"));
		for (String line : lines) {
			assertFalse(line.contains("U["), line);
		}
	}

	@Test
	public void test_atomic_group_shared() {
		Decl.Variable v = VARIABLE("V", map(Type.Int, map(Type.Int, Type.Int)), ANNOTATION("atomic_usedmap"),
				ANNOTATION("atomic_group_shared"));
		BoogieFile input = kernel(ints("x"), SEQUENCE(ASSIGN(VAR("x"), GET(GET(VAR("V"), CONST(0)), CONST(1)))), v);
		TransformResult result = new KernelTransformTask(LOGGER).run(input);
		assertTrue(result.isSuccess(), () -> "unexpected failure " + result.getDiagnostics());
		List<String> lines = lines(result.getFile());
		assertTrue(lines.contains("var {:atomic_usedmap} {:atomic_group_shared} V : [bool][int][int]int;"));
		assertTrue(lines.contains("x$1, x$2 := V[true][0][1], V[_TILE_X$1 == _TILE_X$2][0][1];"));
		for (String line : lines) {
			assertFalse(line.contains("V$1"), line);
		}
	}

	@Test
	public void test_internal_error() {
		BoogieFile input = kernel(List.of(VARIABLE("b", Type.Bool)),
				SEQUENCE(WHILE(VAR("b"), Collections.emptyList(), SEQUENCE(RETURN()))));
		TransformResult result = new KernelTransformTask(LOGGER).run(input);
		assertEquals(TransformResult.Outcome.INTERNAL_ERROR, result.getOutcome());
		assertEquals(3, result.getExitCode().getCode());
		assertEquals(1, result.getDiagnostics().size());
		assertTrue(result.getDiagnostics().get(0).startsWith("internal failure ("));
	}

	@Test
	public void test_eager_race_checking() {
		List<String> lines = lines(transform(new KernelTransformTask(LOGGER).setEagerRaceChecking(true)));
		assertTrue(lines.contains("__CheckForRaces:"));
	}

	@Test
	public void test_full_abstraction() {
		List<String> lines = lines(transform(new KernelTransformTask(LOGGER).setFullAbstraction(true)));
		for (String line : lines) {
			assertFalse(line.startsWith("var {:group_shared} A"), line);
		}
		assertTrue(lines.stream().anyMatch(l -> l.startsWith("call _LOG_WRITE_A(")));
	}

	@Test
	public void test_only_divergence() {
		List<String> lines = lines(transform(new KernelTransformTask(LOGGER).setOnlyDivergence(true)));
		for (String line : lines) {
			assertFalse(line.contains("_LOG_"), line);
		}
	}

	@Test
	public void test_concurrent_runs() throws Exception {
		String expected = BoogieFilePrinter.toString(transform(new KernelTransformTask(LOGGER)));
		ExecutorService executor = Executors.newFixedThreadPool(4);
		try {
			List<Future<TransformResult>> futures = new ArrayList<>();
			for (int i = 0; i != 8; ++i) {
				futures.add(executor.submit(() -> new KernelTransformTask(LOGGER).run(loopKernel())));
			}
			for (Future<TransformResult> f : futures) {
				TransformResult result = f.get(30, TimeUnit.SECONDS);
				assertTrue(result.isSuccess());
				assertEquals(expected, BoogieFilePrinter.toString(result.getFile()));
			}
		} finally {
			executor.shutdown();
		}
	}
}
