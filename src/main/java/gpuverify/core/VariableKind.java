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

import gpuverify.core.BoogieFile.Decl;

/**
 * Classifies the global names of a kernel. Passes consult this instead of
 * looking at annotations directly.
 */
public enum VariableKind {
	/**
	 * Mutable state visible to every thread of the kernel.
	 */
	GLOBAL,
	/**
	 * State shared by the threads of one group, e.g. CUDA <code>__shared__</code>
	 * or OpenCL <code>__local</code> memory.
	 */
	GROUP_SHARED,
	/**
	 * Read-only memory.
	 */
	CONSTANT,
	/**
	 * Memory private to each thread.
	 */
	PRIVATE,
	/**
	 * The thread identifiers <code>_X</code>, <code>_Y</code> and <code>_Z</code>.
	 */
	THREAD_LOCAL_ID,
	/**
	 * The group identifiers <code>_TILE_X</code>, <code>_TILE_Y</code> and
	 * <code>_TILE_Z</code>.
	 */
	GROUP_ID;

	/**
	 * Determine the kind of a global variable from the annotations it was
	 * declared with.
	 *
	 * @param v
	 * @return
	 */
	public static VariableKind of(Decl.Variable v) {
		if (v.hasAnnotation("group_shared") || v.hasAnnotation("tile_static")) {
			return GROUP_SHARED;
		} else if (v.hasAnnotation("constant")) {
			return CONSTANT;
		} else if (v.hasAnnotation("private")) {
			return PRIVATE;
		} else {
			return GLOBAL;
		}
	}

	/**
	 * Determine the kind of a global constant from its name.
	 *
	 * @param c
	 * @return
	 */
	public static VariableKind of(Decl.Constant c) {
		for (Kernel.Axis axis : Kernel.Axis.values()) {
			if (c.getName().equals(axis.localId())) {
				return THREAD_LOCAL_ID;
			} else if (c.getName().equals(axis.groupId())) {
				return GROUP_ID;
			}
		}
		return CONSTANT;
	}

	/**
	 * Shared variables are those two threads can race on.
	 *
	 * @return
	 */
	public boolean isShared() {
		return this == GLOBAL || this == GROUP_SHARED;
	}
}
