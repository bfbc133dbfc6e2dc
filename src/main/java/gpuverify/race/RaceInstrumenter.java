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
package gpuverify.race;

import java.util.List;

import gpuverify.core.BoogieFile;
import gpuverify.core.BoogieFile.Decl;
import gpuverify.core.BoogieFile.Expr;
import gpuverify.core.BoogieFile.Stmt;

/**
 * Adds the shadow state and assertions needed to detect data races between
 * the two threads of a kernel. The declarations and instrumentation are added
 * to the sequential program (i.e. before predication and dualisation), whilst
 * the remaining operations construct statements or expressions over the
 * dualised names (e.g. <code>_WRITE_HAS_OCCURRED_A$1</code>).
 */
public interface RaceInstrumenter {

	/**
	 * Declare the access flags, offset variables and logging procedures for
	 * each shared array which should be checked.
	 *
	 * @param file
	 */
	public void addRaceCheckingDeclarations(BoogieFile file);

	/**
	 * Insert a call to the appropriate logging procedure before each read or
	 * write of a shared array.
	 *
	 * @param file
	 */
	public void addRaceCheckingInstrumentation(BoogieFile file);

	/**
	 * Construct the statements executed by the barrier which check that no
	 * conflicting accesses occurred since the last barrier, and then reset
	 * the access flags.
	 *
	 * @return
	 */
	public List<Stmt> makeRaceCheckingStatements();

	/**
	 * Construct the preconditions of the kernel procedure needed for race
	 * checking, i.e. that no access has occurred on entry.
	 *
	 * @return
	 */
	public List<Expr.Logical> makeKernelPrecondition();

	/**
	 * Construct candidate loop invariants relating to the access flags.
	 *
	 * @return
	 */
	public List<Expr.Logical> makeCandidateInvariants();

	public List<Expr.Logical> makeCandidateRequires(Decl.Procedure procedure);

	public List<Expr.Logical> makeCandidateEnsures(Decl.Procedure procedure);

	/**
	 * Check for races at the point of each access rather than only at
	 * barriers. This operates on the dualised program.
	 *
	 * @param file
	 */
	public void addEagerRaceChecking(BoogieFile file);
}
