package herald.util;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;

public class JsonUtil {

    // error bodies only, no deserialization settings needed
    private static final ObjectMapper mapper = new ObjectMapper().registerModule(new Jdk8Module());

    public static ObjectMapper getObjectMapper() {
        return mapper;
    }

}
