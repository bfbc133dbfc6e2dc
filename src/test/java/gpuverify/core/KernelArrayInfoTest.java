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
import static org.junit.jupiter.api.Assertions.*;

import java.util.List;

import org.junit.jupiter.api.Test;

public class KernelArrayInfoTest {
	private static final Type INT_MAP = new Type.Dictionary(Type.Int, Type.Int);

	private static KernelArrayInfo arrays() {
		KernelArrayInfo arrays = new KernelArrayInfo();
		arrays.add(VARIABLE("G", INT_MAP, ANNOTATION("global")));
		arrays.add(VARIABLE("S", INT_MAP, ANNOTATION("group_shared")));
		arrays.add(VARIABLE("T", INT_MAP, ANNOTATION("tile_static")));
		arrays.add(VARIABLE("C", INT_MAP, ANNOTATION("constant")));
		arrays.add(VARIABLE("P", INT_MAP, ANNOTATION("private")));
		arrays.add(VARIABLE("U", INT_MAP));
		return arrays;
	}

	@Test
	public void test_classification() {
		KernelArrayInfo arrays = arrays();
		assertEquals(VariableKind.GLOBAL, arrays.kindOf("G"));
		assertEquals(VariableKind.GROUP_SHARED, arrays.kindOf("S"));
		assertEquals(VariableKind.GROUP_SHARED, arrays.kindOf("T"));
		assertEquals(VariableKind.CONSTANT, arrays.kindOf("C"));
		assertEquals(VariableKind.PRIVATE, arrays.kindOf("P"));
		assertEquals(VariableKind.GLOBAL, arrays.kindOf("U"));
		assertEquals(List.of("G", "U"), arrays.getGlobalArrays(true));
		assertEquals(List.of("S", "T"), arrays.getGroupSharedArrays(true));
		assertEquals(List.of("G", "S", "T", "U"), arrays.getSharedArrays(true));
		assertEquals(List.of("C"), arrays.getConstantArrays());
		assertEquals(List.of("P"), arrays.getPrivateArrays());
		assertNull(arrays.kindOf("missing"));
	}

	@Test
	public void test_shared_storage() {
		KernelArrayInfo arrays = arrays();
		assertTrue(arrays.hasSharedStorage("G"));
		assertTrue(arrays.hasSharedStorage("S"));
		assertFalse(arrays.hasSharedStorage("T"));
		assertFalse(arrays.hasSharedStorage("U"));
		assertTrue(arrays.requiresGroupIndexing("S"));
		assertFalse(arrays.requiresGroupIndexing("G"));
		assertFalse(arrays.requiresGroupIndexing("T"));
	}

	@Test
	public void test_atomic_used_map() {
		KernelArrayInfo arrays = new KernelArrayInfo();
		arrays.add(VARIABLE("U", INT_MAP, ANNOTATION("atomic_usedmap")));
		assertFalse(arrays.requiresGroupIndexing("U"));
		assertFalse(arrays.isSingleCopy("U"));
		assertEquals(List.of("U"), arrays.getAtomicallyAccessedArrays(true));
	}

	@Test
	public void test_atomic_group_shared() {
		KernelArrayInfo arrays = new KernelArrayInfo();
		arrays.add(VARIABLE("A", INT_MAP, ANNOTATION("atomic_usedmap"), ANNOTATION("atomic_group_shared")));
		assertTrue(arrays.requiresGroupIndexing("A"));
		assertTrue(arrays.isSingleCopy("A"));
		assertFalse(arrays.hasSharedStorage("A"));
		assertEquals(List.of("A"), arrays.getAtomicallyAccessedArrays(true));
	}

	@Test
	public void test_duplicate_add() {
		KernelArrayInfo arrays = arrays();
		assertThrows(IllegalArgumentException.class, () -> arrays.add("G", VariableKind.GLOBAL, INT_MAP));
	}

	@Test
	public void test_non_array_kind() {
		KernelArrayInfo arrays = new KernelArrayInfo();
		assertThrows(IllegalArgumentException.class, () -> arrays.add("_X", VariableKind.THREAD_LOCAL_ID, Type.Int));
	}

	@Test
	public void test_read_only() {
		KernelArrayInfo arrays = arrays();
		arrays.markReadOnly("G");
		assertTrue(arrays.isReadOnly("G"));
		assertEquals(List.of("G"), arrays.getReadOnlyArrays(true));
		assertThrows(IllegalArgumentException.class, () -> arrays.markReadOnly("G"));
		assertThrows(IllegalArgumentException.class, () -> arrays.markReadOnly("C"));
	}

	@Test
	public void test_disable() {
		KernelArrayInfo arrays = arrays();
		arrays.markReadOnly("S");
		arrays.disable("S");
		assertTrue(arrays.isDisabled("S"));
		assertEquals(List.of("G", "T", "U"), arrays.getSharedArrays(false));
		assertEquals(List.of("T"), arrays.getGroupSharedArrays(false));
		assertEquals(List.of(), arrays.getReadOnlyArrays(false));
		assertEquals(List.of("S"), arrays.getReadOnlyArrays(true));
		assertThrows(IllegalArgumentException.class, () -> arrays.disable("S"));
	}
}
