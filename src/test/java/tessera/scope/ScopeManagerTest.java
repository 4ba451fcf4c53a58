package tessera.scope;

import org.junit.jupiter.api.Test;
import tessera.ast.StructuralViolationException;
import tessera.ast.expr.Variable;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static tessera.TestTrees.intVar;

public class ScopeManagerTest {
	private final ScopeManager scopes = new ScopeManager(Set.of("int", "for"));

	@Test
	void reservedWordIsRenamed() {
		assertEquals("int_0000", scopes.declare("int", intVar("int")));
		assertEquals("int_0000", scopes.emittedName("int"));
	}

	@Test
	void redeclaringTheSameNodeKeepsItsName() {
		Variable x = intVar("x");

		assertEquals("x", scopes.declare("x", x));
		assertEquals("x", scopes.declare("x", x));
	}

	@Test
	void secondDeclarationInTheSameScopeIsRenamed() {
		scopes.declare("x", intVar("x"));

		assertEquals("x_0000", scopes.declare("x", intVar("x")));
	}

	@Test
	void innerScopeMayShadowAnOuterName() {
		Variable outer = intVar("x");
		Variable inner = intVar("x");
		scopes.declare("x", outer);

		try (ScopeManager.Guard ignored = scopes.open("f")) {
			assertEquals("x", scopes.declare("x", inner));
			assertSame(inner, scopes.lookup("x"));
		}
		assertSame(outer, scopes.lookup("x"));
	}

	@Test
	void freshNamesAvoidVisibleNames() {
		scopes.declare("i_0000", intVar("i_0000"));

		assertEquals("i_0001", scopes.freshName("i"));
		assertEquals("i_0002", scopes.freshName("i"));
	}

	@Test
	void generatedNameIsNotReusedByANestedDeclaration() {
		String generated = scopes.freshGlobalName("tmp");

		try (ScopeManager.Guard ignored = scopes.open("f")) {
			assertNotEquals(generated, scopes.declare(generated, intVar(generated)));
		}
	}

	@Test
	void unbalancedExitThrows() {
		ScopeManager.Guard outer = scopes.open("outer");
		ScopeManager.Guard inner = scopes.open("inner");

		assertThrows(StructuralViolationException.class, outer::close);

		inner.close();
		outer.close();
		assertEquals(2, scopes.enterCount());
		assertEquals(2, scopes.exitCount());
		assertEquals(0, scopes.depth());
	}

	@Test
	void rootScopeCannotBeExited() {
		assertThrows(StructuralViolationException.class, () -> scopes.exit(scopes.root()));
	}

	@Test
	void closedScopeCannotBeQueried() {
		ScopeManager.Guard guard = scopes.open("f");
		Scope inner = guard.scope();
		guard.close();

		assertTrue(inner.isClosed());
		assertThrows(StructuralViolationException.class, () -> inner.lookup("x"));
	}

	@Test
	void scopeIsExitedWhenTheBodyThrows() {
		assertThrows(IllegalStateException.class, () -> {
			try (ScopeManager.Guard ignored = scopes.open("f")) {
				throw new IllegalStateException("boom");
			}
		});

		assertEquals(0, scopes.depth());
		assertEquals(scopes.enterCount(), scopes.exitCount());
		assertNull(scopes.lookup("x"));
	}
}
