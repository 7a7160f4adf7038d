package in.pollwall.domain.error;

public class DuplicateEmailException extends DomainException {

    public DuplicateEmailException(String email) {
        super("Email already registered: " + email);
    }

    @Override
    public int httpStatus() {
        return 409;
    }
}
