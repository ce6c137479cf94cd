package infix.parser;

public abstract class LexemeVisitor<T, E extends Throwable> {
	public abstract T visit(OperandLexeme operandLexeme) throws E;
	public abstract T visit(NestedFormLexeme nestedFormLexeme) throws E;
	public abstract T visit(OperatorLexeme operatorLexeme) throws E;
	public abstract T visit(GroupStartLexeme groupStartLexeme) throws E;
	public abstract T visit(GroupEndLexeme groupEndLexeme) throws E;
}
