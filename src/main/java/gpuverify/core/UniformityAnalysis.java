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

/**
 * Provides facts about which variables are guaranteed to hold the same value
 * in every thread. Uniform variables need only a single copy after
 * dualisation.
 */
public interface UniformityAnalysis {

	/**
	 * Check whether a given local variable, parameter or return of a
	 * procedure is uniform.
	 *
	 * @param procedure
	 * @param variable
	 * @return
	 */
	public boolean isUniform(String procedure, String variable);

	/**
	 * The analysis which knows nothing, so treats every variable as
	 * non-uniform.
	 */
	public static final UniformityAnalysis NONE = (procedure, variable) -> false;
}
