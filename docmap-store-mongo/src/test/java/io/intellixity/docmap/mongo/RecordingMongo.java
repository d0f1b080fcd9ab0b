package io.intellixity.docmap.mongo;

import com.mongodb.client.ClientSession;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.MongoDatabase;
import com.mongodb.client.result.UpdateResult;
import org.bson.conversions.Bson;

import java.lang.reflect.InvocationHandler;
import java.lang.reflect.Proxy;
import java.util.ArrayList;
import java.util.List;

/**
 * Serverless {@link MongoClient} stand-in that records session, transaction and write calls.
 * <p>
 * {@code updateOne} matches {@link #matchedPerUpdate} documents; everything else returns a default.
 */
final class RecordingMongo {
  final List<String> calls = new ArrayList<>();
  final List<Bson> filters = new ArrayList<>();
  long matchedPerUpdate = 1;
  private boolean activeTx;

  MongoClient client() {
    MongoDatabase db = proxy(MongoDatabase.class, (p, m, args) -> switch (m.getName()) {
      case "getCollection" -> collection();
      default -> fallback(p, m.getName(), m.getReturnType());
    });
    return proxy(MongoClient.class, (p, m, args) -> switch (m.getName()) {
      case "getDatabase" -> db;
      case "startSession" -> {
        calls.add("startSession");
        yield session();
      }
      default -> fallback(p, m.getName(), m.getReturnType());
    });
  }

  private ClientSession session() {
    return proxy(ClientSession.class, (p, m, args) -> {
      String name = m.getName();
      switch (name) {
        case "startTransaction" -> activeTx = true;
        case "commitTransaction", "abortTransaction" -> activeTx = false;
        case "hasActiveTransaction" -> {
          return activeTx;
        }
        default -> {
          if (!isObjectMethod(name)) calls.add(name);
          return fallback(p, name, m.getReturnType());
        }
      }
      calls.add(name);
      return null;
    });
  }

  @SuppressWarnings("unchecked")
  private MongoCollection<org.bson.Document> collection() {
    return proxy(MongoCollection.class, (p, m, args) -> {
      String name = m.getName();
      if (isObjectMethod(name)) return fallback(p, name, m.getReturnType());
      calls.add(name);
      if ("updateOne".equals(name)) {
        filters.add((Bson) args[args.length - 2]);
        return UpdateResult.acknowledged(matchedPerUpdate, matchedPerUpdate, null);
      }
      return null;
    });
  }

  long count(String call) {
    return calls.stream().filter(call::equals).count();
  }

  private static boolean isObjectMethod(String name) {
    return name.equals("toString") || name.equals("hashCode") || name.equals("equals");
  }

  private static Object fallback(Object proxy, String name, Class<?> returnType) {
    if (name.equals("toString")) return "RecordingMongo";
    if (name.equals("hashCode")) return System.identityHashCode(proxy);
    if (returnType == boolean.class) return false;
    if (returnType == int.class) return 0;
    if (returnType == long.class) return 0L;
    return null;
  }

  @SuppressWarnings("unchecked")
  private static <T> T proxy(Class<T> type, InvocationHandler h) {
    return (T) Proxy.newProxyInstance(RecordingMongo.class.getClassLoader(), new Class<?>[]{type}, h);
  }
}
