package tessera.ast.expr;

import tessera.ast.Node;
import tessera.ast.NodeVisitor;
import tessera.ast.SourceSpan;
import tessera.types.ElementKind;
import tessera.types.TypeDescriptor;
import tessera.types.TypedValue;

/**
 * A scalar constant. The value is kept as source text; complex literals carry
 * their real and imaginary parts separately.
 */
public final class Literal extends Node implements TypedValue {
	private final TypeDescriptor type;
	private final String value;
	private final String imaginary;

	public Literal(TypeDescriptor type, String value, String imaginary, SourceSpan span) {
		super(span);
		if (type.rank() != 0) {
			throw new IllegalArgumentException("literals are scalars");
		}
		if ((type.kind() == ElementKind.COMPLEX) != (imaginary != null)) {
			throw new IllegalArgumentException("only complex literals have an imaginary part");
		}
		this.type = type;
		this.value = value;
		this.imaginary = imaginary;
	}

	public static Literal integer(long value) {
		return new Literal(TypeDescriptor.scalar(ElementKind.INTEGER), Long.toString(value), null, SourceSpan.NONE);
	}

	public static Literal integer(long value, int bits) {
		return new Literal(TypeDescriptor.scalar(ElementKind.INTEGER, bits), Long.toString(value), null, SourceSpan.NONE);
	}

	public static Literal floating(String value) {
		return new Literal(TypeDescriptor.scalar(ElementKind.FLOAT), value, null, SourceSpan.NONE);
	}

	public static Literal floating(String value, int bits) {
		return new Literal(TypeDescriptor.scalar(ElementKind.FLOAT, bits), value, null, SourceSpan.NONE);
	}

	public static Literal complex(String real, String imaginary) {
		return new Literal(TypeDescriptor.scalar(ElementKind.COMPLEX), real, imaginary, SourceSpan.NONE);
	}

	public static Literal complex(String real, String imaginary, int bits) {
		return new Literal(TypeDescriptor.scalar(ElementKind.COMPLEX, bits), real, imaginary, SourceSpan.NONE);
	}

	public static Literal bool(boolean value) {
		return new Literal(TypeDescriptor.scalar(ElementKind.BOOL), Boolean.toString(value), null, SourceSpan.NONE);
	}

	public static Literal string(String value) {
		return new Literal(TypeDescriptor.scalar(ElementKind.STRING), value, null, SourceSpan.NONE);
	}

	public String value() {
		return value;
	}

	public String imaginary() {
		return imaginary;
	}

	public boolean isTrue() {
		return type.kind() == ElementKind.BOOL && Boolean.parseBoolean(value);
	}

	@Override
	public TypeDescriptor type() {
		return type;
	}

	@Override
	public <R> R accept(NodeVisitor<R> visitor) {
		return visitor.visitLiteral(this);
	}
}
