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

import java.io.PrintStream;
import java.util.List;

import com.google.common.collect.ImmutableList;

import gpuverify.core.BoogieFile;

/**
 * The outcome of transforming a kernel. When successful, this holds the
 * transformed program. Otherwise, it holds the diagnostics explaining why the
 * kernel could not be transformed. Warnings about ignored candidate
 * invariants may accompany a successful result.
 */
public class TransformResult {

	public enum Outcome {
		/**
		 * The kernel was transformed.
		 */
		SUCCESS,
		/**
		 * The program uses a construct which cannot be handled, such as a map
		 * with more than one key.
		 */
		MALFORMED_INPUT,
		/**
		 * The program does not follow the kernel conventions (e.g. it has two
		 * kernel procedures).
		 */
		WELL_FORMEDNESS_ERROR,
		/**
		 * Something unexpected happened during transformation.
		 */
		INTERNAL_ERROR
	}

	private final Outcome outcome;
	private final BoogieFile file;
	private final List<String> diagnostics;

	private TransformResult(Outcome outcome, BoogieFile file, List<String> diagnostics) {
		this.outcome = outcome;
		this.file = file;
		this.diagnostics = ImmutableList.copyOf(diagnostics);
	}

	public static TransformResult success(BoogieFile file, List<String> warnings) {
		return new TransformResult(Outcome.SUCCESS, file, warnings);
	}

	public static TransformResult failure(Outcome outcome, List<String> diagnostics) {
		if (outcome == Outcome.SUCCESS) {
			throw new IllegalArgumentException("failure cannot have a successful outcome");
		}
		return new TransformResult(outcome, null, diagnostics);
	}

	public Outcome getOutcome() {
		return outcome;
	}

	public boolean isSuccess() {
		return outcome == Outcome.SUCCESS;
	}

	/**
	 * Get the transformed program, or <code>null</code> if transformation
	 * failed.
	 *
	 * @return
	 */
	public BoogieFile getFile() {
		return file;
	}

	public List<String> getDiagnostics() {
		return diagnostics;
	}

	public ToolExitCode getExitCode() {
		switch (outcome) {
		case SUCCESS:
			return ToolExitCode.SUCCESS;
		case MALFORMED_INPUT:
		case WELL_FORMEDNESS_ERROR:
			return ToolExitCode.OTHER_ERROR;
		default:
			return ToolExitCode.INTERNAL_ERROR;
		}
	}

	public void printDiagnostics(PrintStream out) {
		for (String d : diagnostics) {
			out.println(d);
		}
		out.flush();
	}
}
