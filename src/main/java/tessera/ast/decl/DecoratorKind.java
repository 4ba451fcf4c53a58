package tessera.ast.decl;

public enum DecoratorKind {
	KERNEL,
	DEVICE,
	TYPES,
	TEMPLATE,
	OTHER
}
