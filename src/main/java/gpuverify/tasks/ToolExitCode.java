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

/**
 * The exit status reported to the user by the tool. This distinguishes a
 * kernel which could not be verified from one which could not be processed
 * at all.
 */
public enum ToolExitCode {
	SUCCESS(0),
	VERIFICATION_ERROR(1),
	OTHER_ERROR(2),
	INTERNAL_ERROR(3);

	private final int code;

	private ToolExitCode(int code) {
		this.code = code;
	}

	public int getCode() {
		return code;
	}
}
