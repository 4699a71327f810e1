package gdreader;

public class ScriptReadException extends GDReaderException {

	public ScriptReadException(String msg, Throwable cause) {
		super("ScriptReadException", msg, cause);
	}
}
