package gdreader;

public class ReaderSettingsException extends GDReaderException {

	public ReaderSettingsException(String msg) {
		super("ReaderSettingsException", msg);
	}

	public ReaderSettingsException(String msg, Throwable cause) {
		super("ReaderSettingsException", msg, cause);
	}
}
