package shamir.facade;

public class InsufficientSharesException extends SecretSharingException {
	private static final long serialVersionUID = 1L;

	public InsufficientSharesException(String msg) {
		super(msg);
	}
}
