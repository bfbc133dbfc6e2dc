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
import static org.junit.jupiter.api.Assertions.*;

import java.util.Collections;
import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.Test;

import gpuverify.core.BoogieFile;

public class NameResolverTest {

	private static BoogieFile program() {
		BoogieFile file = new BoogieFile();
		file.getDeclarations().add(CONSTANT("_X", Type.Int));
		file.getDeclarations().add(VARIABLE("G", new Type.Dictionary(Type.Int, Type.Int)));
		file.getDeclarations().add(FUNCTION("f", List.of(PARAMETER("x", Type.Int)), Type.Int));
		return file;
	}

	@Test
	public void test_globals_and_scope() {
		NameResolver resolver = new NameResolver(program());
		Expr.Logical e = EQ(GET(VAR("G"), VAR("_X")), VAR("i"));
		assertTrue(resolver.resolves(e, List.of("i")));
		assertEquals(Set.of("i"), resolver.unresolved(e, Collections.emptyList()));
	}

	@Test
	public void test_functions() {
		NameResolver resolver = new NameResolver(program());
		assertTrue(resolver.resolves(EQ(INVOKE("f", VAR("_X")), CONST(0)), Collections.emptyList()));
		assertEquals(Set.of("g"), resolver.unresolved(EQ(INVOKE("g", VAR("_X")), CONST(0)), Collections.emptyList()));
	}

	@Test
	public void test_variable_is_not_function() {
		NameResolver resolver = new NameResolver(program());
		assertEquals(Set.of("G"), resolver.unresolved(EQ(INVOKE("G", CONST(1)), CONST(0)), Collections.emptyList()));
	}
}
