package gdreader;

import org.apache.commons.io.FileUtils;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.logging.Logger;

public class ReaderSettings {
	public static final String VERSION = "0.1.0";
	public static final int DEFAULT_TAB_SIZE = 4;

	private static final Logger logger = Logger.getLogger("ReaderSettings");

	// fields extracted from the JSON settings file
	private int tabSize = DEFAULT_TAB_SIZE;

	public ReaderSettings() {
	}

	public ReaderSettings(int tabSize) {
		if (tabSize <= 0) {
			throw new ReaderSettingsException("tab_size must be positive, got " + tabSize);
		}
		this.tabSize = tabSize;
	}

	/**
	 * Columns a tab character counts for when block indentation is compared.
	 */
	public int getTabSize() {
		return tabSize;
	}

	/**
	 * Reads settings from a JSON document of the form <code>{"reader": {"tab_size": 4}}</code>.
	 * Missing keys keep their defaults; unknown keys are ignored.
	 */
	public static ReaderSettings fromJson(String json) throws ReaderSettingsException {
		JSONObject config;
		try {
			config = new JSONObject(json);
		} catch (JSONException e) {
			throw new ReaderSettingsException("parsing error: " + e.getMessage(), e);
		}

		ReaderSettings settings = new ReaderSettings();
		if (!config.has("reader")) {
			return settings;
		}
		try {
			JSONObject reader = config.getJSONObject("reader");
			if (reader.has("tab_size")) {
				int tabSize = reader.getInt("tab_size");
				if (tabSize <= 0) {
					throw new ReaderSettingsException("tab_size must be positive, got " + tabSize);
				}
				settings.tabSize = tabSize;
			}
		} catch (JSONException e) {
			throw new ReaderSettingsException("invalid reader settings: " + e.getMessage(), e);
		}
		return settings;
	}

	public static ReaderSettings fromFile(Path path) throws ReaderSettingsException {
		String s;
		try {
			s = FileUtils.readFileToString(path.toFile(), StandardCharsets.UTF_8);
		} catch (IOException ex) {
			throw new ReaderSettingsException("Error reading settings file: " + ex.getMessage(), ex);
		}
		logger.info("loading reader settings from " + path);
		try {
			return fromJson(s);
		} catch (ReaderSettingsException e) {
			throw new ReaderSettingsException(path + ": " + e.getMsg(), e);
		}
	}

	@Override
	public String toString() {
		return "ReaderSettings [tabSize=" + tabSize + "]";
	}
}
