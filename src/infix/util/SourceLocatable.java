package infix.util;

/**
 * 
 * A common abstract base, meant for tokens and call tree nodes, that should be
 * implemented by anything that needs to be traced back to the place the reader
 * found it.
 *
 */
public abstract class SourceLocatable {

	public abstract SourceLocation getLocation();

}
