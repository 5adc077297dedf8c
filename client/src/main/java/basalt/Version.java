package basalt;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

@SuppressWarnings("unused")
public class Version {
    public static final String VERSION;
    public static final String VERSION_MAJOR;
    public static final String VERSION_MINOR;
    public static final String VERSION_REVISION;
    
    static {
        var version = readVersion();
        VERSION = version == null || version.startsWith("$") ? "0.0.0-dev" : version;
        var parts = VERSION.split("[.-]");
        VERSION_MAJOR = parts[0];
        VERSION_MINOR = parts.length > 1 ? parts[1] : "0";
        VERSION_REVISION = parts.length > 2 ? parts[2] : "0";
    }
    
    private static String readVersion() {
        try(InputStream in = Version.class.getResourceAsStream("version.properties")) {
            if(in == null) {
                return null;
            }
            var properties = new Properties();
            properties.load(in);
            return properties.getProperty("version");
        } catch(IOException e) {
            throw new ExceptionInInitializerError(e);
        }
    }
}
