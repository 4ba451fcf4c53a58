package tessera.parse.directive;

import org.junit.jupiter.api.Test;
import tessera.directive.Clause;
import tessera.directive.DirectiveComment;
import tessera.directive.DirectiveGrammar;
import tessera.directive.OmpVersion;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class DirectiveParserTest {
	private static DirectiveComment parse(OmpVersion version, String text) {
		return new DirectiveParser(DirectiveGrammar.standard().schema(version)).parse(text, 7);
	}

	private static DirectiveSyntaxException reject(OmpVersion version, String text) {
		return assertThrows(DirectiveSyntaxException.class, () -> parse(version, text));
	}

	@Test
	void parsesCombinedConstructWithClauses() {
		DirectiveComment d = parse(OmpVersion.V4_5,
				"#$ omp parallel for reduction(+:s) private(i, j) schedule(static, 4)");

		assertFalse(d.end());
		assertEquals("parallel", d.construct());
		assertEquals("for", d.combined());
		assertEquals("parallel for", d.fullConstruct());
		assertTrue(d.spec().loop());
		assertEquals(3, d.clauses().size());

		Clause reduction = d.clause("reduction");
		assertEquals("+", reduction.modifier());
		assertEquals(List.of("s"), reduction.arguments());
		assertEquals(List.of("i", "j"), d.clause("private").arguments());
		assertEquals(List.of("static", "4"), d.clause("schedule").arguments());
		assertEquals("parallel for reduction(+:s) private(i, j) schedule(static, 4)", d.clauseText());
	}

	@Test
	void prefersTheLongestMultiWordConstruct() {
		DirectiveComment d = parse(OmpVersion.V4_5, "#$ omp target data map(to: a)");

		assertEquals("target data", d.construct());
		assertNull(d.combined());
		assertEquals("to", d.clause("map").modifier());
		assertEquals(List.of("a"), d.clause("map").arguments());
	}

	@Test
	void prefersTheLongestCombinedForm() {
		DirectiveComment d = parse(OmpVersion.V4_5, "#$ omp target teams distribute parallel for simd collapse(2)");

		assertEquals("target", d.construct());
		assertEquals("teams distribute parallel for simd", d.combined());
		assertTrue(d.spec().loop());
	}

	@Test
	void parsesEndDirectives() {
		DirectiveComment d = parse(OmpVersion.V4_5, "#$ omp end single nowait");

		assertTrue(d.end());
		assertEquals("end single nowait", d.clauseText());
	}

	@Test
	void commasBetweenClausesAreOptional() {
		DirectiveComment d = parse(OmpVersion.V4_5, "#$ omp parallel private(a), shared(b)");

		assertEquals("parallel private(a) shared(b)", d.clauseText());
	}

	@Test
	void constructArgumentIsKept() {
		assertEquals("lock", parse(OmpVersion.V4_5, "#$ omp critical(lock)").argument());
		assertNull(parse(OmpVersion.V4_5, "#$ omp critical").argument());
	}

	@Test
	void clauseFromALaterVersionIsRejected() {
		DirectiveSyntaxException e = reject(OmpVersion.V4_5, "#$ omp parallel for order(concurrent)");

		assertTrue(e.getMessage().contains("requires OpenMP 5.0"), e.getMessage());
		assertEquals(7, e.line());
		assertEquals("#$ omp parallel for order(concurrent)", e.text());

		assertEquals("concurrent", parse(OmpVersion.V5_0, "#$ omp parallel for order(concurrent)")
				.clause("order").arguments().get(0));
	}

	@Test
	void constructsFollowTheVersion() {
		reject(OmpVersion.V4_5, "#$ omp loop");
		assertEquals("loop", parse(OmpVersion.V5_0, "#$ omp loop").construct());

		reject(OmpVersion.V5_0, "#$ omp masked filter(0)");
		assertEquals("masked", parse(OmpVersion.V5_1, "#$ omp masked filter(0)").construct());

		reject(OmpVersion.V4_5, "#$ omp parallel loop");
		assertEquals("loop", parse(OmpVersion.V5_0, "#$ omp parallel loop").combined());
	}

	@Test
	void clauseNotAllowedOnConstructIsRejected() {
		DirectiveSyntaxException e = reject(OmpVersion.V4_5, "#$ omp single reduction(+:s)");

		assertTrue(e.getMessage().contains("not allowed on 'single'"), e.getMessage());
	}

	@Test
	void enumeratedClauseValuesAreChecked() {
		DirectiveSyntaxException e = reject(OmpVersion.V4_5, "#$ omp parallel default(everything)");

		assertTrue(e.getMessage().contains("invalid value 'everything'"), e.getMessage());
	}

	@Test
	void argumentFormsAreEnforced() {
		reject(OmpVersion.V4_5, "#$ omp parallel num_threads");
		reject(OmpVersion.V4_5, "#$ omp parallel for nowait(1)");
		reject(OmpVersion.V4_5, "#$ omp barrier(x)");
	}

	@Test
	void malformedTextIsRejected() {
		reject(OmpVersion.V4_5, "#$ omp parallel private(a");
		reject(OmpVersion.V4_5, "#$ acc parallel");
		reject(OmpVersion.V4_5, "#$ omp frobnicate");
		reject(OmpVersion.V4_5, "#$ omp parallel private(a) ;");
	}

	@Test
	void splitsAtTopLevelCommasOnly() {
		assertEquals(List.of("a[0:n, 1]", "b"), DirectiveParser.splitTopLevel("a[0:n, 1], b"));
	}
}
