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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.google.common.base.Preconditions;

import gpuverify.core.BoogieFile.Decl;
import gpuverify.core.BoogieFile.Type;

/**
 * Records how each array declared by a kernel is classified. Every array
 * belongs to exactly one of the global, group-shared, constant or private
 * classes. A global or group-shared array may additionally be marked as
 * read-only (because no implementation writes it) or disabled (so that no
 * race checking is done for it).
 */
public class KernelArrayInfo {
	private final Map<String, VariableKind> kinds = new LinkedHashMap<>();
	private final Map<String, Type> types = new LinkedHashMap<>();
	private final Set<String> sharedStorage = new LinkedHashSet<>();
	private final Set<String> atomicallyAccessed = new LinkedHashSet<>();
	private final Set<String> atomicGroupShared = new LinkedHashSet<>();
	private final Set<String> readOnly = new LinkedHashSet<>();
	private final Set<String> disabled = new LinkedHashSet<>();

	/**
	 * Classify and record a global variable declaration.
	 *
	 * @param v
	 */
	public void add(Decl.Variable v) {
		add(v.getName(), VariableKind.of(v), v.getType());
		if (v.hasAnnotation("global") || v.hasAnnotation("group_shared")) {
			sharedStorage.add(v.getName());
		}
		if (v.hasAnnotation("atomic_group_shared") || v.hasAnnotation("atomic_usedmap")) {
			atomicallyAccessed.add(v.getName());
		}
		if (v.hasAnnotation("atomic_group_shared")) {
			atomicGroupShared.add(v.getName());
		}
	}

	public void add(String name, VariableKind kind, Type type) {
		Preconditions.checkArgument(kind != VariableKind.THREAD_LOCAL_ID && kind != VariableKind.GROUP_ID,
				"%s is not an array kind", kind);
		Preconditions.checkArgument(!kinds.containsKey(name), "array %s already classified as %s", name,
				kinds.get(name));
		kinds.put(name, kind);
		types.put(name, type);
	}

	public VariableKind kindOf(String name) {
		return kinds.get(name);
	}

	public Type getType(String name) {
		return types.get(name);
	}

	public boolean contains(String name) {
		return kinds.containsKey(name);
	}

	public boolean isShared(String name) {
		VariableKind kind = kinds.get(name);
		return kind != null && kind.isShared();
	}

	public boolean isConstant(String name) {
		return kinds.get(name) == VariableKind.CONSTANT;
	}

	/**
	 * Check whether both threads see the same storage for this array, in which
	 * case it is never renamed per thread.
	 *
	 * @param name
	 * @return
	 */
	public boolean hasSharedStorage(String name) {
		return sharedStorage.contains(name);
	}

	/**
	 * Check whether both threads access this array through one declaration.
	 * This holds for arrays with shared storage and for arrays whose atomic
	 * accesses are shared within a group.
	 *
	 * @param name
	 * @return
	 */
	public boolean isSingleCopy(String name) {
		return sharedStorage.contains(name) || atomicGroupShared.contains(name);
	}

	/**
	 * Check whether accesses to this array must select through a leading
	 * group index, so that threads in different groups see different copies.
	 * Atomically accessed arrays need this only when marked
	 * <code>{:atomic_group_shared}</code>.
	 *
	 * @param name
	 * @return
	 */
	public boolean requiresGroupIndexing(String name) {
		return (kinds.get(name) == VariableKind.GROUP_SHARED && sharedStorage.contains(name))
				|| atomicGroupShared.contains(name);
	}

	public List<String> getGlobalArrays(boolean includeDisabled) {
		return select(VariableKind.GLOBAL, includeDisabled);
	}

	public List<String> getGroupSharedArrays(boolean includeDisabled) {
		return select(VariableKind.GROUP_SHARED, includeDisabled);
	}

	public List<String> getConstantArrays() {
		return select(VariableKind.CONSTANT, true);
	}

	public List<String> getPrivateArrays() {
		return select(VariableKind.PRIVATE, true);
	}

	/**
	 * Get all global and group-shared arrays, in declaration order.
	 *
	 * @param includeDisabled
	 * @return
	 */
	public List<String> getSharedArrays(boolean includeDisabled) {
		ArrayList<String> result = new ArrayList<>();
		for (Map.Entry<String, VariableKind> e : kinds.entrySet()) {
			if (e.getValue().isShared() && (includeDisabled || !disabled.contains(e.getKey()))) {
				result.add(e.getKey());
			}
		}
		return result;
	}

	public List<String> getReadOnlyArrays(boolean includeDisabled) {
		return filterDisabled(readOnly, includeDisabled);
	}

	public List<String> getAtomicallyAccessedArrays(boolean includeDisabled) {
		return filterDisabled(atomicallyAccessed, includeDisabled);
	}

	public void markReadOnly(String name) {
		Preconditions.checkArgument(isShared(name), "%s is not a global or group-shared array", name);
		Preconditions.checkArgument(!readOnly.contains(name), "%s already marked read-only", name);
		readOnly.add(name);
	}

	public boolean isReadOnly(String name) {
		return readOnly.contains(name);
	}

	public void disable(String name) {
		Preconditions.checkArgument(isShared(name), "%s is not a global or group-shared array", name);
		Preconditions.checkArgument(!disabled.contains(name), "%s already disabled", name);
		disabled.add(name);
	}

	public boolean isDisabled(String name) {
		return disabled.contains(name);
	}

	private List<String> select(VariableKind kind, boolean includeDisabled) {
		ArrayList<String> result = new ArrayList<>();
		for (Map.Entry<String, VariableKind> e : kinds.entrySet()) {
			if (e.getValue() == kind && (includeDisabled || !disabled.contains(e.getKey()))) {
				result.add(e.getKey());
			}
		}
		return result;
	}

	private List<String> filterDisabled(Set<String> names, boolean includeDisabled) {
		ArrayList<String> result = new ArrayList<>();
		for (String n : names) {
			if (includeDisabled || !disabled.contains(n)) {
				result.add(n);
			}
		}
		return result;
	}
}
