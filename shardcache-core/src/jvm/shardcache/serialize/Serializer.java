package shardcache.serialize;

import java.io.Serializable;

public interface Serializer extends Serializable {
    byte[] serialize(Object o);
    Object deserialize(byte[] bytes);
}
