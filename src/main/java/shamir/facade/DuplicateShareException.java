package shamir.facade;

/**
 * Thrown when two shares carry the same index.
 */
public class DuplicateShareException extends SecretSharingException {
	private static final long serialVersionUID = 1L;

	public DuplicateShareException(String msg) {
		super(msg);
	}
}
