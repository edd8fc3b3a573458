package ctxfree;

import java.io.BufferedReader;
import java.io.File;
import java.io.FileReader;
import java.io.IOException;
import java.util.HashMap;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Bounds of the algorithms.
 *
 * Defaults can be overridden by a <pre>ctxfree.ini</pre> file in the working directory
 * (lines of the form <pre>key = value</pre>) and by <pre>-Dctxfree.key=value</pre> system properties.
 */
public class Config {

	private static final Logger LOG = Logger.getLogger(Config.class.getName());

	public static final String configFile = "ctxfree.ini";

	private static final Map<String, String> config = new HashMap<String, String>(){{
		put("factoringBoundFactor", "2");
		put("parserExpansionLimit", "10000");
	}};

	/**
	 * The left factoring depth (and step) bound is this factor times the grammar size.
	 */
	public static int factoringBoundFactor(){
		return intValue("factoringBoundFactor");
	}

	/**
	 * Maximum number of expansions the LL parser performs without consuming a token.
	 */
	public static int parserExpansionLimit(){
		return intValue("parserExpansionLimit");
	}

	private static int intValue(String key){
		String value = System.getProperty("ctxfree." + key, config.get(key));
		try {
			return Integer.parseInt(value.trim());
		} catch (NumberFormatException ex){
			LOG.warning(() -> String.format("Invalid value \"%s\" for config key \"%s\", using the default", value, key));
			return Integer.parseInt(config.get(key));
		}
	}

	private static void loadConfig(){
		File file = new File(configFile);
		if (!file.exists()){
			return;
		}
		try (BufferedReader reader = new BufferedReader(new FileReader(file))) {
			String line;
			while ((line = reader.readLine()) != null){
				if (line.contains(" = ")){
					String[] parts = line.split(" = ", 2);
					if (config.containsKey(parts[0].trim())){
						config.put(parts[0].trim(), parts[1].trim());
					} else {
						LOG.warning("Unknown config key \"" + parts[0] + "\"");
					}
				}
			}
		} catch (IOException e) {
			LOG.log(Level.WARNING, "Can't read " + configFile, e);
		}
	}

	static {
		loadConfig();
	}
}
