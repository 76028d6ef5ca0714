package shamir.facade;

/**
 * Thrown when a share string cannot be parsed.
 */
public class MalformedShareException extends SecretSharingException {
	private static final long serialVersionUID = 1L;

	public MalformedShareException(String msg) {
		super(msg);
	}

	public MalformedShareException(String msg, Throwable throwable) {
		super(msg, throwable);
	}
}
