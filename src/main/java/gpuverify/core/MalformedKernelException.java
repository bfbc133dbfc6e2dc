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
 * Signals that the input program uses a construct the kernel transformations
 * cannot handle, such as a shared array with a multi-key map type. There is no
 * way to recover from this other than fixing the input.
 */
public class MalformedKernelException extends RuntimeException {
	private static final long serialVersionUID = 1L;

	public MalformedKernelException(String message) {
		super(message);
	}
}
