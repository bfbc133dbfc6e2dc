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

import gpuverify.core.BoogieFile.Expr;

/**
 * Turns the text of a single boolean expression (e.g. a user-supplied
 * candidate invariant) into an expression tree. Parsing of the intermediate
 * language is provided elsewhere.
 */
public interface ExpressionParser {

	/**
	 * Parse a given line of text as a boolean expression.
	 *
	 * @param text
	 * @return
	 * @throws SyntaxError
	 *             if the text is not a well-formed boolean expression.
	 */
	public Expr.Logical parse(String text) throws SyntaxError;

	public static class SyntaxError extends Exception {
		private static final long serialVersionUID = 1L;

		public SyntaxError(String message) {
			super(message);
		}
	}
}
