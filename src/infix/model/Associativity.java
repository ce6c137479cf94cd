package infix.model;

public enum Associativity {
	LEFT,
	RIGHT,
}
