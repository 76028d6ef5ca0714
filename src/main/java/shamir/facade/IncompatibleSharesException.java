package shamir.facade;

/**
 * Thrown when the supplied shares were not produced by the same split.
 */
public class IncompatibleSharesException extends SecretSharingException {
	private static final long serialVersionUID = 1L;

	public IncompatibleSharesException(String msg) {
		super(msg);
	}
}
