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

import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import gpuverify.core.BoogieFile;

public class TransformResultTest {

	@ParameterizedTest
	@CsvSource({ "MALFORMED_INPUT, OTHER_ERROR, 2", "WELL_FORMEDNESS_ERROR, OTHER_ERROR, 2",
			"INTERNAL_ERROR, INTERNAL_ERROR, 3" })
	public void test_failure_exit_codes(TransformResult.Outcome outcome, ToolExitCode expected, int code) {
		TransformResult result = TransformResult.failure(outcome, List.of("oops"));
		assertFalse(result.isSuccess());
		assertNull(result.getFile());
		assertEquals(expected, result.getExitCode());
		assertEquals(code, result.getExitCode().getCode());
	}

	@Test
	public void test_success() {
		BoogieFile file = new BoogieFile();
		TransformResult result = TransformResult.success(file, Collections.emptyList());
		assertTrue(result.isSuccess());
		assertSame(file, result.getFile());
		assertEquals(ToolExitCode.SUCCESS, result.getExitCode());
		assertEquals(0, result.getExitCode().getCode());
	}

	@Test
	public void test_failure_cannot_succeed() {
		assertThrows(IllegalArgumentException.class,
				() -> TransformResult.failure(TransformResult.Outcome.SUCCESS, List.of()));
	}

	@Test
	public void test_diagnostics_copied() {
		List<String> diagnostics = new ArrayList<>(List.of("first"));
		TransformResult result = TransformResult.failure(TransformResult.Outcome.MALFORMED_INPUT, diagnostics);
		diagnostics.add("second");
		assertEquals(List.of("first"), result.getDiagnostics());
		assertThrows(UnsupportedOperationException.class, () -> result.getDiagnostics().add("third"));
	}

	@Test
	public void test_print_diagnostics() {
		ByteArrayOutputStream bytes = new ByteArrayOutputStream();
		TransformResult result = TransformResult.failure(TransformResult.Outcome.WELL_FORMEDNESS_ERROR,
				List.of("no kernel", "no barrier"));
		result.printDiagnostics(new PrintStream(bytes, true, StandardCharsets.UTF_8));
		assertEquals(List.of("no kernel", "no barrier"),
				List.of(bytes.toString(StandardCharsets.UTF_8).split("\\R")));
	}
}
