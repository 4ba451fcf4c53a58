package tessera.ast;

import tessera.ast.decl.ClassDef;
import tessera.ast.decl.FunctionArgument;
import tessera.ast.decl.FunctionDef;
import tessera.ast.decl.Import;
import tessera.ast.decl.Interface;
import tessera.ast.decl.Module;
import tessera.ast.decl.Program;
import tessera.ast.expr.ArrayAllocation;
import tessera.ast.expr.ArrayShapeElement;
import tessera.ast.expr.ArraySize;
import tessera.ast.expr.AttributeAccess;
import tessera.ast.expr.BinaryOp;
import tessera.ast.expr.CallArgument;
import tessera.ast.expr.Cast;
import tessera.ast.expr.Comprehension;
import tessera.ast.expr.FunctionCall;
import tessera.ast.expr.IndexedElement;
import tessera.ast.expr.LibraryCall;
import tessera.ast.expr.ListLiteral;
import tessera.ast.expr.Literal;
import tessera.ast.expr.Nil;
import tessera.ast.expr.Parenthesis;
import tessera.ast.expr.Range;
import tessera.ast.expr.Slice;
import tessera.ast.expr.Symbol;
import tessera.ast.expr.TernaryOp;
import tessera.ast.expr.TupleLiteral;
import tessera.ast.expr.UnaryOp;
import tessera.ast.expr.Variable;
import tessera.ast.stmt.AliasAssign;
import tessera.ast.stmt.Assign;
import tessera.ast.stmt.AugAssign;
import tessera.ast.stmt.Break;
import tessera.ast.stmt.CodeBlock;
import tessera.ast.stmt.Comment;
import tessera.ast.stmt.CommentBlock;
import tessera.ast.stmt.Continue;
import tessera.ast.stmt.Del;
import tessera.ast.stmt.Directive;
import tessera.ast.stmt.For;
import tessera.ast.stmt.If;
import tessera.ast.stmt.IfSection;
import tessera.ast.stmt.KernelCall;
import tessera.ast.stmt.Pass;
import tessera.ast.stmt.Print;
import tessera.ast.stmt.Return;
import tessera.ast.stmt.While;

/**
 * One method per node variant. A printer implements all of them, so adding a
 * variant without a rendering rule fails to compile.
 */
public interface NodeVisitor<R> {
	// expressions
	R visitVariable(Variable node);

	R visitLiteral(Literal node);

	R visitSymbol(Symbol node);

	R visitBinaryOp(BinaryOp node);

	R visitUnaryOp(UnaryOp node);

	R visitParenthesis(Parenthesis node);

	R visitTernaryOp(TernaryOp node);

	R visitCast(Cast node);

	R visitIndexedElement(IndexedElement node);

	R visitSlice(Slice node);

	R visitAttributeAccess(AttributeAccess node);

	R visitFunctionCall(FunctionCall node);

	R visitCallArgument(CallArgument node);

	R visitLibraryCall(LibraryCall node);

	R visitArraySize(ArraySize node);

	R visitArrayShapeElement(ArrayShapeElement node);

	R visitArrayAllocation(ArrayAllocation node);

	R visitRange(Range node);

	R visitTupleLiteral(TupleLiteral node);

	R visitListLiteral(ListLiteral node);

	R visitNil(Nil node);

	R visitComprehension(Comprehension node);

	// statements
	R visitAssign(Assign node);

	R visitAliasAssign(AliasAssign node);

	R visitAugAssign(AugAssign node);

	R visitCodeBlock(CodeBlock node);

	R visitFor(For node);

	R visitWhile(While node);

	R visitIf(If node);

	R visitIfSection(IfSection node);

	R visitReturn(Return node);

	R visitBreak(Break node);

	R visitContinue(Continue node);

	R visitPass(Pass node);

	R visitPrint(Print node);

	R visitComment(Comment node);

	R visitCommentBlock(CommentBlock node);

	R visitDel(Del node);

	R visitKernelCall(KernelCall node);

	R visitDirective(Directive node);

	// definitions
	R visitFunctionDef(FunctionDef node);

	R visitFunctionArgument(FunctionArgument node);

	R visitInterface(Interface node);

	R visitClassDef(ClassDef node);

	R visitImport(Import node);

	R visitModule(Module node);

	R visitProgram(Program node);
}
