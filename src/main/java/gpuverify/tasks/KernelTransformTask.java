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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.apache.log4j.Logger;

import gpuverify.core.BoogieFile;
import gpuverify.core.Kernel;
import gpuverify.core.MalformedKernelException;
import gpuverify.core.UniformityAnalysis;
import gpuverify.race.NullRaceInstrumenter;
import gpuverify.race.RaceInstrumenter;
import gpuverify.race.StandardRaceInstrumenter;
import gpuverify.transform.BarrierGenerator;
import gpuverify.transform.CandidateInvariantGenerator;
import gpuverify.transform.ConstantWriteInstrumenter;
import gpuverify.transform.ExpressionParser;
import gpuverify.transform.KernelChecker;
import gpuverify.transform.KernelDualiser;
import gpuverify.transform.KernelPreconditionGenerator;
import gpuverify.transform.Predicator;
import gpuverify.transform.SharedStateAbstractor;
import gpuverify.transform.StructuralNormaliser;

/**
 * Transforms a kernel into the two-thread program whose verification
 * establishes that the kernel is free from data races and barrier
 * divergence. The transformation proceeds in a fixed sequence of passes over
 * a private copy of the given program, so the caller's program is never
 * modified and independent runs may proceed concurrently.
 */
public class KernelTransformTask {
	/**
	 * Logger for progress messages
	 */
	private Logger logger;
	/**
	 * Check only for barrier divergence, not for races.
	 */
	private boolean onlyDivergence = false;
	/**
	 * Abstract away the contents of shared arrays entirely.
	 */
	private boolean fullAbstraction = false;
	/**
	 * Generate candidate invariants for the fixpoint solver.
	 */
	private boolean inference = true;
	/**
	 * Check for races at each access rather than only at barriers.
	 */
	private boolean eagerRaceChecking = false;
	/**
	 * Consider only pairs of threads in the same group.
	 */
	private boolean onlyIntraGroup = false;
	private boolean symmetry = false;
	private boolean raceCheckingContract = false;
	private UniformityAnalysis uniformity = UniformityAnalysis.NONE;
	private final Set<String> halfDualisedProcedures = new LinkedHashSet<>();
	private final Set<String> halfDualisedVariables = new LinkedHashSet<>();
	private String userInvariantSource = "";
	private List<String> userInvariants = Collections.emptyList();
	private ExpressionParser parser;

	public KernelTransformTask() {
		this(Logger.getLogger(KernelTransformTask.class));
	}

	public KernelTransformTask(Logger logger) {
		if (logger == null) {
			throw new IllegalArgumentException("invalid logger");
		}
		this.logger = logger;
	}

	public KernelTransformTask setLogger(Logger logger) {
		this.logger = logger;
		return this;
	}

	public KernelTransformTask setOnlyDivergence(boolean flag) {
		this.onlyDivergence = flag;
		return this;
	}

	public KernelTransformTask setFullAbstraction(boolean flag) {
		this.fullAbstraction = flag;
		return this;
	}

	public KernelTransformTask setInference(boolean flag) {
		this.inference = flag;
		return this;
	}

	public KernelTransformTask setEagerRaceChecking(boolean flag) {
		this.eagerRaceChecking = flag;
		return this;
	}

	public KernelTransformTask setOnlyIntraGroupRaceChecking(boolean flag) {
		this.onlyIntraGroup = flag;
		return this;
	}

	public KernelTransformTask setSymmetry(boolean flag) {
		this.symmetry = flag;
		return this;
	}

	public KernelTransformTask setRaceCheckingContract(boolean flag) {
		this.raceCheckingContract = flag;
		return this;
	}

	public KernelTransformTask setUniformityAnalysis(UniformityAnalysis uniformity) {
		this.uniformity = uniformity;
		return this;
	}

	public KernelTransformTask addHalfDualisedProcedure(String name) {
		halfDualisedProcedures.add(name);
		return this;
	}

	public KernelTransformTask addHalfDualisedVariable(String name) {
		halfDualisedVariables.add(name);
		return this;
	}

	public KernelTransformTask setUserSuppliedInvariants(String source, List<String> lines) {
		this.userInvariantSource = source;
		this.userInvariants = new ArrayList<>(lines);
		return this;
	}

	public KernelTransformTask setExpressionParser(ExpressionParser parser) {
		this.parser = parser;
		return this;
	}

	/**
	 * The business end of the task. Every failure is turned into a result
	 * rather than being thrown, so the caller need only map the result onto
	 * an exit code.
	 *
	 * @param input
	 *            The program being transformed, which is left unchanged.
	 * @return
	 */
	public TransformResult run(BoogieFile input) {
		BoogieFile file = input.copy();
		try {
			KernelChecker checker = new KernelChecker(logger);
			Kernel kernel = checker.check(file);
			if (kernel == null) {
				return TransformResult.failure(TransformResult.Outcome.WELL_FORMEDNESS_ERROR, checker.getErrors());
			}
			return TransformResult.success(file, transform(file, kernel));
		} catch (MalformedKernelException e) {
			logger.error(e.getMessage());
			return TransformResult.failure(TransformResult.Outcome.MALFORMED_INPUT,
					Collections.singletonList(e.getMessage()));
		} catch (IllegalStateException | IllegalArgumentException e) {
			logger.error("internal failure", e);
			return TransformResult.failure(TransformResult.Outcome.INTERNAL_ERROR,
					Collections.singletonList("internal failure (" + e.getMessage() + ")"));
		}
	}

	/**
	 * Apply each pass in turn to a well-formed kernel.
	 *
	 * @param file
	 * @param kernel
	 * @return Any warnings generated.
	 */
	private List<String> transform(BoogieFile file, Kernel kernel) {
		List<String> warnings = new ArrayList<>();
		new StructuralNormaliser(kernel, logger).apply(file);
		new ConstantWriteInstrumenter(kernel.getArrays(), logger).apply(file);
		RaceInstrumenter races = createRaceInstrumenter(kernel);
		races.addRaceCheckingDeclarations(file);
		races.addRaceCheckingInstrumentation(file);
		if (fullAbstraction) {
			new SharedStateAbstractor(kernel.getArrays(), logger).apply(file);
		}
		new Predicator(kernel, logger).apply(file);
		KernelDualiser dualiser = new KernelDualiser(kernel, logger).setUniformityAnalysis(uniformity)
				.setOnlyIntraGroupRaceChecking(onlyIntraGroup).setSymmetry(symmetry);
		for (String p : halfDualisedProcedures) {
			dualiser.addHalfDualisedProcedure(p);
		}
		for (String v : halfDualisedVariables) {
			dualiser.addHalfDualisedVariable(v);
		}
		dualiser.apply(file);
		if (eagerRaceChecking) {
			races.addEagerRaceChecking(file);
		}
		new BarrierGenerator(kernel, races, logger).setOnlyDivergence(onlyDivergence)
				.setFullAbstraction(fullAbstraction).apply(file);
		new KernelPreconditionGenerator(kernel, races, logger).setOnlyIntraGroupRaceChecking(onlyIntraGroup)
				.apply(file);
		if (inference) {
			CandidateInvariantGenerator generator = new CandidateInvariantGenerator(kernel, races, logger)
					.setFullAbstraction(fullAbstraction).setRaceCheckingContract(raceCheckingContract)
					.setExpressionParser(parser).setUserSuppliedInvariants(userInvariantSource, userInvariants);
			generator.apply(file);
			warnings.addAll(generator.getWarnings());
		}
		return warnings;
	}

	private RaceInstrumenter createRaceInstrumenter(Kernel kernel) {
		if (onlyDivergence) {
			return new NullRaceInstrumenter();
		} else {
			return new StandardRaceInstrumenter(kernel, logger).setOnlyIntraGroupRaceChecking(onlyIntraGroup);
		}
	}
}
