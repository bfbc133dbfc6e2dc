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
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import gpuverify.core.BoogieFile.Expr;
import gpuverify.core.BoogieFile.Type;

/**
 * The facts established about a kernel by the well-formedness check: which
 * procedure is the kernel, which is the barrier, which special constants are
 * declared (and with which types), and how the kernel's arrays are
 * classified.
 */
public class Kernel {

	/**
	 * A dimension of the thread grid. Each dimension has a quartet of special
	 * constants: the thread id within its group, the group size, the number of
	 * groups and the group id.
	 */
	public enum Axis {
		X, Y, Z;

		public String localId() {
			return "_" + name();
		}

		public String groupSize() {
			return "_TILE_SIZE_" + name();
		}

		public String numGroups() {
			return "_NUM_TILES_" + name();
		}

		public String groupId() {
			return "_TILE_" + name();
		}

		public List<String> constants() {
			List<String> names = new ArrayList<>();
			names.add(localId());
			names.add(groupSize());
			names.add(numGroups());
			names.add(groupId());
			return names;
		}
	}

	private final String kernelName;
	private final String barrierName;
	private final Map<String, Type> specialConstants;
	private final KernelArrayInfo arrays;

	public Kernel(String kernelName, String barrierName, Map<String, Type> specialConstants,
			KernelArrayInfo arrays) {
		this.kernelName = kernelName;
		this.barrierName = barrierName;
		this.specialConstants = Collections.unmodifiableMap(new LinkedHashMap<>(specialConstants));
		this.arrays = arrays;
	}

	public String getKernelName() {
		return kernelName;
	}

	public String getBarrierName() {
		return barrierName;
	}

	public KernelArrayInfo getArrays() {
		return arrays;
	}

	public Map<String, Type> getSpecialConstants() {
		return specialConstants;
	}

	public boolean isSpecialConstant(String name) {
		return specialConstants.containsKey(name);
	}

	public Type getSpecialConstantType(String name) {
		return specialConstants.get(name);
	}

	public boolean hasAxis(Axis axis) {
		return specialConstants.containsKey(axis.localId());
	}

	/**
	 * Get the dimensions this kernel is defined over, starting with X.
	 *
	 * @return
	 */
	public List<Axis> getAxes() {
		List<Axis> axes = new ArrayList<>();
		for (Axis axis : Axis.values()) {
			if (hasAxis(axis)) {
				axes.add(axis);
			}
		}
		return axes;
	}

	/**
	 * The type of thread identifiers, i.e. the type of <code>_X</code>.
	 *
	 * @return
	 */
	public Type getThreadIdType() {
		return specialConstants.get(Axis.X.localId());
	}

	/**
	 * Construct the condition under which the two thread copies belong to the
	 * same group, i.e. <code>_TILE_X$1 == _TILE_X$2 &amp;&amp; ...</code> over
	 * each dimension of the kernel.
	 *
	 * @return
	 */
	public Expr.Logical getSameGroupPredicate() {
		List<Expr.Logical> clauses = new ArrayList<>();
		for (Axis axis : getAxes()) {
			clauses.add(BoogieFile.EQ(BoogieFile.VAR(threadCopy(axis.groupId(), 1)),
					BoogieFile.VAR(threadCopy(axis.groupId(), 2))));
		}
		return BoogieFile.AND(clauses);
	}

	/**
	 * Get the name of a given thread's copy of a variable, e.g.
	 * <code>x$1</code>.
	 *
	 * @param name
	 * @param thread
	 * @return
	 */
	public static String threadCopy(String name, int thread) {
		return name + "$" + thread;
	}

	public static boolean isThreadLocalId(String name) {
		for (Axis axis : Axis.values()) {
			if (axis.localId().equals(name)) {
				return true;
			}
		}
		return false;
	}

	public static boolean isGroupId(String name) {
		for (Axis axis : Axis.values()) {
			if (axis.groupId().equals(name)) {
				return true;
			}
		}
		return false;
	}
}
