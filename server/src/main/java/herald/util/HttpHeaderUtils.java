package herald.util;

import java.util.Map;

import com.google.common.collect.HashMultimap;
import com.google.common.collect.Multimap;

import io.netty.handler.codec.http.HttpHeaders;

public class HttpHeaderUtils {

    public static Multimap<String,String> toMultimap(HttpHeaders headers) {
        Multimap<String,String> headerMultimap = HashMultimap.create();
        if (headers != null) {
            for (Map.Entry<String,String> e : headers.entries()) {
                // header names are case-insensitive
                headerMultimap.put(e.getKey().toLowerCase(), e.getValue());
            }
        }
        return headerMultimap;
    }
}
