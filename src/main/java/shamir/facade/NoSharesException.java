package shamir.facade;

/**
 * Thrown when recovery is requested without any share.
 */
public class NoSharesException extends SecretSharingException {
	private static final long serialVersionUID = 1L;

	public NoSharesException(String msg) {
		super(msg);
	}
}
