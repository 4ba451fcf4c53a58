package tessera.print;

import org.junit.jupiter.api.Test;
import tessera.ast.decl.ImportTarget;
import tessera.scope.ScopeManager;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static tessera.TestTrees.intVar;

public class ImportRegistryTest {
	private final ScopeManager scopes = new ScopeManager(Target.PYTHON.reservedWords());
	private final ImportRegistry registry = new ImportRegistry(NameSwaps.python(), scopes);

	@Test
	void registeringTwiceAddsOneImport() {
		assertEquals("zeros", registry.register("numpy", "zeros"));
		assertEquals("zeros", registry.register("numpy", "zeros"));

		assertEquals(List.of(new ImportEntry("numpy", "zeros", null)), registry.synthesized());
	}

	@Test
	void targetNamesAreSwappedAtEmission() {
		assertEquals("max", registry.register("numpy", "amax"));
		assertEquals("random", registry.register("numpy.random", "rand"));
		registry.register("omp_lib", "omp_get_num_threads");

		assertEquals(new ImportEntry("tessera.stdlib.internal.openmp", "omp_get_num_threads", null),
				registry.synthesized().get(2));
	}

	@Test
	void collidingNameIsAliased() {
		scopes.declare("size", intVar("size"));

		String local = registry.register("numpy", "size");

		assertEquals("size_0000", local);
		assertEquals(new ImportEntry("numpy", "size", "size_0000"), registry.synthesized().get(0));
		assertEquals("lambda_0000", registry.register("mylib", "lambda"));
	}

	@Test
	void writtenImportsAreReused() {
		assertEquals("zeros", registry.recordExisting("numpy", new ImportTarget("zeros", "np_zeros")));

		assertEquals("np_zeros", registry.register("numpy", "zeros"));
		assertTrue(registry.synthesized().isEmpty());
	}

	@Test
	void headersAreIncludedOnce() {
		ImportRegistry headers = new ImportRegistry(NameSwaps.none(), new ScopeManager(Set.of()));

		headers.include("<math.h>");
		headers.include("<math.h>");
		headers.include("\"ndarrays.h\"");

		assertEquals(List.of(new ImportEntry("<math.h>", null, null), new ImportEntry("\"ndarrays.h\"", null, null)),
				headers.synthesized());
	}
}
