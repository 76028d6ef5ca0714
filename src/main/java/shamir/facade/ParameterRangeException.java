package shamir.facade;

/**
 * Thrown when share count, threshold or byte width is outside the supported range.
 */
public class ParameterRangeException extends SecretSharingException {
	private static final long serialVersionUID = 1L;

	public ParameterRangeException(String msg) {
		super(msg);
	}
}
