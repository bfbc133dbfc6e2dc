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

import java.util.ArrayList;
import java.util.List;

import org.apache.log4j.Logger;

import com.google.common.base.Preconditions;

import gpuverify.core.BoogieFile;
import gpuverify.core.Kernel;
import gpuverify.race.RaceInstrumenter;

/**
 * Adds the preconditions of the dualised kernel procedure. These constrain
 * the thread grid to be non-empty, the two threads to be distinct, and each
 * thread and group identifier to lie within range. For example, a
 * one-dimensional kernel over integers obtains:
 *
 * <pre>
 * requires _TILE_SIZE_X &gt; 0;
 * requires _NUM_TILES_X &gt; 0;
 * requires _TILE_X$1 &gt;= 0 &amp;&amp; _TILE_X$1 &lt; _NUM_TILES_X;
 * requires _TILE_X$2 &gt;= 0 &amp;&amp; _TILE_X$2 &lt; _NUM_TILES_X;
 * requires _X$1 != _X$2 || _TILE_X$1 != _TILE_X$2;
 * requires _X$1 &gt;= 0 &amp;&amp; _X$1 &lt; _TILE_SIZE_X;
 * requires _X$2 &gt;= 0 &amp;&amp; _X$2 &lt; _TILE_SIZE_X;
 * </pre>
 *
 * Over <code>bv32</code> the unsigned comparison functions
 * <code>BV32_GT</code> (etc) are used instead.
 */
public class KernelPreconditionGenerator {
	public static final String BV32_GT = "BV32_GT";
	public static final String BV32_GEQ = "BV32_GEQ";
	public static final String BV32_LT = "BV32_LT";

	private final Logger logger;
	private final Kernel kernel;
	private final RaceInstrumenter races;
	private boolean onlyIntraGroup;
	private boolean usesBitVectors;

	public KernelPreconditionGenerator(Kernel kernel, RaceInstrumenter races, Logger logger) {
		this.kernel = kernel;
		this.races = races;
		this.logger = logger;
	}

	public KernelPreconditionGenerator setOnlyIntraGroupRaceChecking(boolean flag) {
		this.onlyIntraGroup = flag;
		return this;
	}

	public void apply(BoogieFile file) {
		Decl.Procedure kp = file.getProcedure(kernel.getKernelName());
		Preconditions.checkState(kp != null, "kernel procedure %s not found", kernel.getKernelName());
		usesBitVectors = false;
		List<Expr.Logical> requires = new ArrayList<>(kp.getRequires());
		requires.addAll(races.makeKernelPrecondition());
		requires.addAll(makeGridPreconditions());
		file.replace(kp, kp.withContract(requires, kp.getEnsures()));
		if (usesBitVectors) {
			declareFunction(file, BV32_GT, "bvugt");
			declareFunction(file, BV32_GEQ, "bvuge");
			declareFunction(file, BV32_LT, "bvult");
		}
		logger.debug("added " + (requires.size() - kp.getRequires().size()) + " kernel preconditions");
	}

	private List<Expr.Logical> makeGridPreconditions() {
		ArrayList<Expr.Logical> result = new ArrayList<>();
		List<Kernel.Axis> axes = kernel.getAxes();
		for (Kernel.Axis axis : axes) {
			result.add(greaterThan(VAR(axis.groupSize()), zero(axis.groupSize())));
			result.add(greaterThan(VAR(axis.numGroups()), zero(axis.numGroups())));
			for (String id : groupIds(axis)) {
				result.add(inRange(id, axis.numGroups()));
			}
		}
		// The two threads are distinct
		ArrayList<Expr.Logical> distinct = new ArrayList<>();
		for (Kernel.Axis axis : axes) {
			distinct.add(NEQ(VAR(Kernel.threadCopy(axis.localId(), 1)), VAR(Kernel.threadCopy(axis.localId(), 2))));
		}
		if (!onlyIntraGroup) {
			for (Kernel.Axis axis : axes) {
				distinct.add(NEQ(VAR(Kernel.threadCopy(axis.groupId(), 1)), VAR(Kernel.threadCopy(axis.groupId(), 2))));
			}
		}
		result.add(DISJOIN(distinct));
		for (Kernel.Axis axis : axes) {
			for (int thread = 1; thread <= 2; ++thread) {
				result.add(inRange(Kernel.threadCopy(axis.localId(), thread), axis.groupSize()));
			}
		}
		return result;
	}

	private List<String> groupIds(Kernel.Axis axis) {
		ArrayList<String> result = new ArrayList<>();
		if (onlyIntraGroup) {
			result.add(axis.groupId());
		} else {
			result.add(Kernel.threadCopy(axis.groupId(), 1));
			result.add(Kernel.threadCopy(axis.groupId(), 2));
		}
		return result;
	}

	/**
	 * Construct <code>0 &lt;= id &lt; bound</code>, where the type of the
	 * comparison is that of the bound.
	 *
	 * @param id
	 * @param bound
	 * @return
	 */
	private Expr.Logical inRange(String id, String bound) {
		Expr lower = zero(bound);
		if (isBitVector(bound)) {
			usesBitVectors = true;
			return CONJOIN(INVOKE(BV32_GEQ, VAR(id), lower), INVOKE(BV32_LT, VAR(id), VAR(bound)));
		}
		return CONJOIN(GTEQ(VAR(id), lower), LT(VAR(id), VAR(bound)));
	}

	private Expr.Logical greaterThan(Expr lhs, Expr rhs) {
		if (rhs instanceof Expr.BitVectorConstant) {
			usesBitVectors = true;
			return INVOKE(BV32_GT, lhs, rhs);
		}
		return GT(lhs, rhs);
	}

	private Expr zero(String constant) {
		return isBitVector(constant) ? BV(0, 32) : CONST(0);
	}

	private boolean isBitVector(String constant) {
		Type type = kernel.getSpecialConstantType(constant);
		return type instanceof Type.BitVector;
	}

	private static void declareFunction(BoogieFile file, String name, String builtin) {
		for (Decl.Function f : file.getDeclarations(Decl.Function.class)) {
			if (f.getName().equals(name)) {
				return;
			}
		}
		List<Decl.Parameter> parameters = new ArrayList<>();
		parameters.add(PARAMETER("x", Type.BitVector32));
		parameters.add(PARAMETER("y", Type.BitVector32));
		file.getDeclarations().add(FUNCTION(name, parameters, Type.Bool, ANNOTATION("bvbuiltin", builtin)));
	}
}
