package tessera.diag;

public enum Severity {
	WARNING,
	ERROR,
	FATAL
}
