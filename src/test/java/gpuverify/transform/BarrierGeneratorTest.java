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
import gpuverify.race.NullRaceInstrumenter;
import gpuverify.tasks.KernelTransformTask;
import gpuverify.tasks.TransformResult;

public class BarrierGeneratorTest {

	private static BoogieFile transform(KernelTransformTask task) {
		TransformResult result = task.setInference(false).run(loopKernel());
		assertTrue(result.isSuccess(), () -> "unexpected failure " + result.getDiagnostics());
		return result.getFile();
	}

	@Test
	public void test_barrier() {
		BoogieFile file = transform(new KernelTransformTask(LOGGER));
		assertEquals(List.of("implementation {:barrier} {:inline 1} bugle_barrier(_P$1 : bool, _P$2 : bool)", "{",
				"__BarrierImpl:", "assert {:barrier_divergence} _P$1 == _P$2;", "if((!_P$1) && (!_P$2)) {", "return;",
				"}",
				"assert {:write_write_race} !((_TILE_X$1 == _TILE_X$2) && _WRITE_HAS_OCCURRED_A$1 "
						+ "&& _WRITE_HAS_OCCURRED_A$2 && (_WRITE_OFFSET_X_A$1 == _WRITE_OFFSET_X_A$2));",
				"assert {:write_read_race} !((_TILE_X$1 == _TILE_X$2) && _WRITE_HAS_OCCURRED_A$1 "
						+ "&& _READ_HAS_OCCURRED_A$2 && (_WRITE_OFFSET_X_A$1 == _READ_OFFSET_X_A$2));",
				"assert {:read_write_race} !((_TILE_X$1 == _TILE_X$2) && _READ_HAS_OCCURRED_A$1 "
						+ "&& _WRITE_HAS_OCCURRED_A$2 && (_READ_OFFSET_X_A$1 == _WRITE_OFFSET_X_A$2));",
				"_READ_HAS_OCCURRED_A$1 := false;", "_READ_HAS_OCCURRED_A$2 := false;",
				"_WRITE_HAS_OCCURRED_A$1 := false;", "_WRITE_HAS_OCCURRED_A$2 := false;", "__HavocSharedState:",
				"havoc A;", "havoc G$1, G$2;", "assume G$1 == G$2;", "}"), lines(file.getImplementation(BARRIER)));
	}

	@Test
	public void test_barrier_procedure() {
		BoogieFile file = transform(new KernelTransformTask(LOGGER));
		Decl.Procedure barrier = file.getProcedure(BARRIER);
		assertTrue(barrier.hasAnnotation("inline"));
		assertEquals(List.of("_READ_HAS_OCCURRED_A$1", "_READ_HAS_OCCURRED_A$2", "_WRITE_HAS_OCCURRED_A$1",
				"_WRITE_HAS_OCCURRED_A$2", "A", "G$1", "G$2"), barrier.getModifies());
		List<String> kernelModifies = file.getProcedure(KERNEL).getModifies();
		assertTrue(kernelModifies.contains("A"));
		assertTrue(kernelModifies.contains("G$2"));
	}

	@Test
	public void test_only_divergence() {
		BoogieFile file = transform(new KernelTransformTask(LOGGER).setOnlyDivergence(true));
		assertEquals(List.of("__BarrierImpl:", "assert {:barrier_divergence} _P$1 == _P$2;",
				"if((!_P$1) && (!_P$2)) {", "return;", "}", "__HavocSharedState:", "havoc A;", "havoc G$1, G$2;",
				"assume G$1 == G$2;"), lines(file.getImplementation(BARRIER).getBody()));
	}

	@Test
	public void test_only_divergence_full_abstraction() {
		BoogieFile file = transform(new KernelTransformTask(LOGGER).setOnlyDivergence(true).setFullAbstraction(true));
		assertEquals(List.of("__BarrierImpl:", "assert {:barrier_divergence} _P$1 == _P$2;"),
				lines(file.getImplementation(BARRIER).getBody()));
	}

	@Test
	public void test_full_abstraction() {
		BoogieFile file = transform(new KernelTransformTask(LOGGER).setFullAbstraction(true));
		List<String> body = lines(file.getImplementation(BARRIER).getBody());
		assertTrue(body.contains("if((!_P$1) && (!_P$2)) {"));
		assertFalse(body.contains("__HavocSharedState:"));
		assertTrue(body.get(body.size() - 1).equals("_WRITE_HAS_OCCURRED_A$2 := false;"));
	}

	@Test
	public void test_existing_implementation_replaced() {
		BoogieFile file = kernel(Collections.emptyList(), SEQUENCE());
		Kernel kernel = check(file);
		// stands in for predication and dualisation of the barrier
		file.replace(file.getProcedure(BARRIER), PROCEDURE(BARRIER,
				List.of(PARAMETER("_P$1", Type.Bool), PARAMETER("_P$2", Type.Bool)), Collections.emptyList(),
				ANNOTATION("barrier"), ANNOTATION("inline", CONST(1))));
		file.getDeclarations().add(IMPLEMENTATION(BARRIER, Collections.emptyList(), Collections.emptyList(),
				Collections.emptyList(), SEQUENCE(RETURN())));
		new BarrierGenerator(kernel, new NullRaceInstrumenter(), LOGGER).setFullAbstraction(true).apply(file);
		assertEquals(1, file.getDeclarations(Decl.Implementation.class).stream()
				.filter(i -> i.getName().equals(BARRIER)).count());
		assertEquals(List.of("procedure {:barrier} {:inline 1} bugle_barrier(_P$1 : bool, _P$2 : bool);"),
				lines(file.getProcedure(BARRIER)));
		assertEquals(List.of("__BarrierImpl:", "assert {:barrier_divergence} _P$1 == _P$2;",
				"if((!_P$1) && (!_P$2)) {", "return;", "}"), lines(file.getImplementation(BARRIER).getBody()));
	}

	@Test
	public void test_unpredicated_barrier() {
		BoogieFile file = kernel(Collections.emptyList(), SEQUENCE());
		BarrierGenerator generator = new BarrierGenerator(check(file), new NullRaceInstrumenter(), LOGGER);
		assertThrows(IllegalStateException.class, () -> generator.apply(file));
	}
}
