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

import java.util.Collections;
import java.util.List;

import gpuverify.core.BoogieFile;
import gpuverify.core.BoogieFile.Decl;
import gpuverify.core.BoogieFile.Expr;
import gpuverify.core.BoogieFile.Stmt;

/**
 * A race instrumenter which does nothing, used when only barrier divergence
 * is being checked.
 */
public class NullRaceInstrumenter implements RaceInstrumenter {

	@Override
	public void addRaceCheckingDeclarations(BoogieFile file) {
	}

	@Override
	public void addRaceCheckingInstrumentation(BoogieFile file) {
	}

	@Override
	public List<Stmt> makeRaceCheckingStatements() {
		return Collections.emptyList();
	}

	@Override
	public List<Expr.Logical> makeKernelPrecondition() {
		return Collections.emptyList();
	}

	@Override
	public List<Expr.Logical> makeCandidateInvariants() {
		return Collections.emptyList();
	}

	@Override
	public List<Expr.Logical> makeCandidateRequires(Decl.Procedure procedure) {
		return Collections.emptyList();
	}

	@Override
	public List<Expr.Logical> makeCandidateEnsures(Decl.Procedure procedure) {
		return Collections.emptyList();
	}

	@Override
	public void addEagerRaceChecking(BoogieFile file) {
	}
}
