package infix;

/**
 * An infix exception consisting of a prefix (type of error) and a message. Every
 * failure the compiler reports to its callers is one of these.
 *
 */
public abstract class InfixException extends RuntimeException {
	private final String msg;
	private final String prefix;

	public InfixException(String prefix, String msg) {
		super(prefix + ": " + msg);
		this.prefix = prefix;
		this.msg = msg;
	}

	public String getMsg() {
		return msg;
	}

	public String getPrefix() {
		return prefix;
	}
}
