package infix;

public class Unreachable extends RuntimeException {
	public Unreachable(Exception e) {
		super("unreachable", e);
	}
}
