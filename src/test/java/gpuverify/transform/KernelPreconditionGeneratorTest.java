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
import gpuverify.race.NullRaceInstrumenter;
import gpuverify.util.Util;

public class KernelPreconditionGeneratorTest {

	private static BoogieFile generate(Type idType, boolean onlyIntraGroup) {
		BoogieFile file = kernel(idType, Collections.emptyList(), SEQUENCE());
		new KernelPreconditionGenerator(check(file), new NullRaceInstrumenter(), LOGGER)
				.setOnlyIntraGroupRaceChecking(onlyIntraGroup).apply(file);
		return file;
	}

	@Test
	public void test_integers() {
		BoogieFile file = generate(Type.Int, false);
		assertEquals(List.of("procedure {:kernel} foo();", "requires _TILE_SIZE_X > 0;", "requires _NUM_TILES_X > 0;",
				"requires (_TILE_X$1 >= 0) && (_TILE_X$1 < _NUM_TILES_X);",
				"requires (_TILE_X$2 >= 0) && (_TILE_X$2 < _NUM_TILES_X);",
				"requires (_X$1 != _X$2) || (_TILE_X$1 != _TILE_X$2);",
				"requires (_X$1 >= 0) && (_X$1 < _TILE_SIZE_X);",
				"requires (_X$2 >= 0) && (_X$2 < _TILE_SIZE_X);"), lines(file.getProcedure(KERNEL)));
		assertTrue(file.getDeclarations(Decl.Function.class).isEmpty());
	}

	@Test
	public void test_intra_group() {
		List<String> lines = lines(generate(Type.Int, true).getProcedure(KERNEL));
		assertTrue(lines.contains("requires (_TILE_X >= 0) && (_TILE_X < _NUM_TILES_X);"));
		assertTrue(lines.contains("requires _X$1 != _X$2;"));
		assertEquals(7, lines.size());
	}

	@Test
	public void test_bit_vectors() {
		BoogieFile file = generate(Type.BitVector32, false);
		List<String> lines = lines(file.getProcedure(KERNEL));
		assertEquals("requires BV32_GT(_TILE_SIZE_X, 0bv32);", lines.get(1));
		assertEquals("requires BV32_GEQ(_TILE_X$1, 0bv32) && BV32_LT(_TILE_X$1, _NUM_TILES_X);", lines.get(3));
		assertEquals(List.of("BV32_GT", "BV32_GEQ", "BV32_LT"), functionNames(file.getDeclarations(Decl.Function.class)));
		assertEquals(List.of("function {:bvbuiltin \"bvugt\"} BV32_GT(x : bv32, y : bv32) returns (bool);"),
				lines(file.getDeclarations(Decl.Function.class).get(0)));
	}

	@Test
	public void test_existing_function_kept() {
		BoogieFile file = kernel(Type.BitVector32, Collections.emptyList(), SEQUENCE());
		Decl.Function existing = FUNCTION("BV32_LT",
				List.of(PARAMETER("a", Type.BitVector32), PARAMETER("b", Type.BitVector32)), Type.Bool,
				ANNOTATION("bvbuiltin", "bvult"));
		file.getDeclarations().add(existing);
		new KernelPreconditionGenerator(check(file), new NullRaceInstrumenter(), LOGGER).apply(file);
		List<Decl.Function> functions = file.getDeclarations(Decl.Function.class);
		assertEquals(3, functions.size());
		assertSame(existing, functions.get(0));
	}

	private static List<String> functionNames(List<Decl.Function> functions) {
		return Util.map(functions, Decl.Function::getName);
	}
}
