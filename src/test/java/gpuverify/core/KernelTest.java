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

import static gpuverify.core.KernelFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.Test;

import gpuverify.core.BoogieFile.Type;
import gpuverify.io.BoogieFilePrinter;

public class KernelTest {

	@Test
	public void test_axis_constants() {
		assertEquals(List.of("_Y", "_TILE_SIZE_Y", "_NUM_TILES_Y", "_TILE_Y"), Kernel.Axis.Y.constants());
	}

	@Test
	public void test_one_dimension() {
		Kernel kernel = check(kernel(Collections.emptyList(), BoogieFile.SEQUENCE()));
		assertEquals(KERNEL, kernel.getKernelName());
		assertEquals(BARRIER, kernel.getBarrierName());
		assertEquals(List.of(Kernel.Axis.X), kernel.getAxes());
		assertSame(Type.Int, kernel.getThreadIdType());
		assertTrue(kernel.isSpecialConstant("_NUM_TILES_X"));
		assertEquals("_TILE_X$1 == _TILE_X$2", BoogieFilePrinter.toString(kernel.getSameGroupPredicate()));
	}

	@Test
	public void test_two_dimensions() {
		BoogieFile file = kernel(Collections.emptyList(), BoogieFile.SEQUENCE(),
				axisConstants(Type.Int, Kernel.Axis.Y).toArray(new BoogieFile.Decl[0]));
		Kernel kernel = check(file);
		assertEquals(List.of(Kernel.Axis.X, Kernel.Axis.Y), kernel.getAxes());
		assertEquals("(_TILE_X$1 == _TILE_X$2) && (_TILE_Y$1 == _TILE_Y$2)",
				BoogieFilePrinter.toString(kernel.getSameGroupPredicate()));
	}

	@Test
	public void test_special_names() {
		assertEquals("x$2", Kernel.threadCopy("x", 2));
		assertTrue(Kernel.isThreadLocalId("_Z"));
		assertFalse(Kernel.isThreadLocalId("_TILE_Z"));
		assertTrue(Kernel.isGroupId("_TILE_Z"));
		assertFalse(Kernel.isGroupId("_Z"));
	}
}
