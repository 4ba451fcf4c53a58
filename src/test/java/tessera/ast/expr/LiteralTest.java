package tessera.ast.expr;

import org.junit.jupiter.api.Test;
import tessera.ast.SourceSpan;
import tessera.types.ElementKind;
import tessera.types.TypeDescriptor;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class LiteralTest {
	@Test
	void factoriesCarryPrecision() {
		assertTrue(Literal.integer(3).type().precision().isDefault());
		assertEquals(32, Literal.integer(3, 32).type().precision().bits());
		assertEquals("2.0", Literal.complex("1.0", "2.0").imaginary());
	}

	@Test
	void onlyTrueBooleanIsTrue() {
		assertTrue(Literal.bool(true).isTrue());
		assertFalse(Literal.bool(false).isTrue());
		assertFalse(Literal.string("true").isTrue());
	}

	@Test
	void imaginaryPartOnlyOnComplex() {
		assertThrows(IllegalArgumentException.class,
				() -> new Literal(TypeDescriptor.scalar(ElementKind.FLOAT), "1.0", "2.0", SourceSpan.NONE));
		assertThrows(IllegalArgumentException.class,
				() -> new Literal(TypeDescriptor.scalar(ElementKind.COMPLEX), "1.0", null, SourceSpan.NONE));
	}
}
