package my.fundextractor.app.live;

public class LivePageException extends RuntimeException {
	public LivePageException(String message, Throwable cause) {
		super(message, cause);
	}
}
