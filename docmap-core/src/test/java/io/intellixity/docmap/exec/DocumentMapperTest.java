package io.intellixity.docmap.exec;

import io.intellixity.docmap.query.QuerySpec;
import io.intellixity.docmap.query.SortField;
import io.intellixity.docmap.record.CustomCollectionName;
import io.intellixity.docmap.record.DocumentField;
import io.intellixity.docmap.record.FieldMappingException;
import io.intellixity.docmap.record.Gadget;
import io.intellixity.docmap.store.DocumentNotFoundException;
import io.intellixity.docmap.store.FieldUpdate;
import io.intellixity.docmap.store.InMemoryDocumentStore;
import io.intellixity.docmap.store.StoreException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static io.intellixity.docmap.query.QueryFilters.*;
import static org.junit.jupiter.api.Assertions.*;

final class DocumentMapperTest {
  static final class Invoice implements CustomCollectionName {
    String id;
    String tenant = "acme";
    @DocumentField("total") long total;

    @Override
    public String collectionName() { return tenant + "_invoices"; }
  }

  private InMemoryDocumentStore store;
  private DocumentMapper mapper;

  @BeforeEach
  void setUp() {
    store = new InMemoryDocumentStore();
    mapper = DocumentMapper.create(Session.of(store), DocmapConfig.defaults());
  }

  private String seed(String name, double price) {
    Item i = new Item(name, price);
    mapper.save(i);
    return i.id;
  }

  @Test
  void saveAssignsIdentifierAndFindOneReadsItBack() {
    Item widget = new Item("Widget", 10);
    mapper.save(widget);

    assertFalse(widget.id.isEmpty());
    Map<String, Object> raw = store.raw("items", widget.id);
    assertEquals("Widget", raw.get("name"));
    assertEquals(10.0, raw.get("price"));
    assertFalse(raw.containsKey("id"));

    Item found = mapper.findOne(List.of(QuerySpec.of(gt("price", 5))), new Item());
    assertEquals(widget.id, found.id);
    assertEquals("Widget", found.name);
    assertEquals(10.0, found.price);
    assertEquals(1, store.queries().get(0).limit());
  }

  @Test
  void saveWithIdentifierOverwritesWholeDocument() {
    store.set("items", "fixed", Map.of("name", "old", "legacy", true));
    Item i = new Item("new", 3);
    i.id = "fixed";
    mapper.save(i);

    Map<String, Object> raw = store.raw("items", "fixed");
    assertEquals("new", raw.get("name"));
    assertFalse(raw.containsKey("legacy"));
    assertEquals(1, store.count("items"));
  }

  @Test
  void saveSelectedFieldsUpdatesOnlyThose() {
    String id = seed("Widget", 10);
    Item change = Item.withId(id);
    change.name = "Gizmo";
    change.price = 99;

    mapper.save(change, "price");

    Map<String, Object> raw = store.raw("items", id);
    assertEquals("Widget", raw.get("name"));
    assertEquals(99.0, raw.get("price"));
  }

  @Test
  void saveSelectedFieldsValidatesBeforeWriting() {
    String id = seed("Widget", 10);
    int writes = store.directWrites();

    FieldMappingException unknown = assertThrows(FieldMappingException.class,
        () -> mapper.save(Item.withId(id), "price", "colour"));
    assertEquals("colour", unknown.field());

    MapperPreconditionException noId = assertThrows(MapperPreconditionException.class,
        () -> mapper.save(new Item("x", 1), "price"));
    assertEquals("cannot update fields on a record with no ID", noId.getMessage());
    assertEquals(writes, store.directWrites());
  }

  @Test
  void getByIdPopulatesRecord() {
    String id = seed("Widget", 10);
    Item i = mapper.getById(Item.withId(id));
    assertEquals("Widget", i.name);
    assertEquals(id, i.id);
  }

  @Test
  void getByIdMissingOrWithoutIdentifier() {
    DocumentNotFoundException e = assertThrows(DocumentNotFoundException.class, () -> mapper.getById(Item.withId("nope")));
    assertEquals("items", e.collection());
    assertEquals("nope", e.documentId());
    assertTrue(DocumentNotFoundException.isNotFound(new StoreException("wrapped", e)));

    MapperPreconditionException empty = assertThrows(MapperPreconditionException.class, () -> mapper.getById(new Item()));
    assertEquals("ID cannot be empty", empty.getMessage());
  }

  @Test
  void findOneWithNoMatchIsNotFound() {
    seed("Widget", 1);
    DocumentNotFoundException e = assertThrows(DocumentNotFoundException.class,
        () -> mapper.findOne(List.of(QuerySpec.of(gt("price", 5))), new Item()));
    assertNull(e.documentId());
  }

  @Test
  void findAllDecodesFreshInstancesInQueryOrder() {
    seed("b", 2);
    seed("a", 1);
    seed("c", 3);

    List<Item> all = mapper.findAll(List.of(QuerySpec.create().orderBy(SortField.asc("name"))), Item.class);
    assertEquals(List.of("a", "b", "c"), all.stream().map(i -> i.name).toList());
    assertTrue(all.stream().allMatch(i -> i.id != null && !i.id.isEmpty()));

    assertEquals(3, mapper.findAll(null, Item.class).size());
    assertTrue(mapper.findAll(List.of(QuerySpec.of(eq("name", "zzz"))), Item.class).isEmpty());
  }

  @Test
  void updateByIdentifierTouchesOneDocument() {
    String id = seed("Widget", 10);
    assertEquals(1, mapper.update(Item.withId(id), List.of(FieldUpdate.of("price", 0))));
    assertEquals(0, store.raw("items", id).get("price"));
    assertEquals(0, store.commits());

    assertThrows(DocumentNotFoundException.class,
        () -> mapper.update(Item.withId("nope"), List.of(FieldUpdate.of("price", 0))));
  }

  @Test
  void updateNeedsIdentifierOrConditions() {
    List<FieldUpdate> u = List.of(FieldUpdate.of("price", 0));
    MapperPreconditionException e = assertThrows(MapperPreconditionException.class, () -> mapper.update(new Item(), u));
    assertEquals("either ID or query conditions must be provided", e.getMessage());
    assertThrows(MapperPreconditionException.class, () -> mapper.update(new Item(), u, List.of(QuerySpec.create())));
    assertThrows(IllegalArgumentException.class, () -> mapper.update(Item.withId("x"), List.of()));
  }

  @Test
  void deleteIsIdempotentAndNeedsIdentifier() {
    String id = seed("Widget", 10);
    mapper.delete(Item.withId(id));
    assertNull(store.raw("items", id));
    mapper.delete(Item.withId(id));

    MapperPreconditionException e = assertThrows(MapperPreconditionException.class, () -> mapper.delete(new Item()));
    assertEquals("ID cannot be empty for delete", e.getMessage());
  }

  @Test
  void bindingReturnsNewMappers() {
    DocumentMapper items = mapper.model(Item.class);
    DocumentMapper small = items.withUpdateBatchSize(5);

    assertNull(mapper.modelType());
    assertEquals(Item.class, items.modelType());
    assertEquals("items", items.collectionName());
    assertEquals(100, items.updateBatchSize());
    assertEquals(5, small.updateBatchSize());
    assertThrows(MapperPreconditionException.class, mapper::collectionName);
    assertThrows(IllegalArgumentException.class, () -> mapper.withUpdateBatchSize(0));
  }

  @Test
  void missingRecordOrStoreFailsFast() {
    MapperPreconditionException noModel = assertThrows(MapperPreconditionException.class, () -> mapper.save(null));
    assertTrue(noModel.getMessage().startsWith("no model set"));

    DocumentMapper detached = mapper.withSession(Session.of(null));
    MapperPreconditionException noStore = assertThrows(MapperPreconditionException.class,
        () -> detached.getById(Item.withId("a")));
    assertEquals("document store is required", noStore.getMessage());
  }

  @Test
  void transactionalMapperRoutesThroughTransaction() {
    String id = seed("Widget", 10);
    int writes = store.directWrites();

    store.runTransaction(tx -> {
      DocumentMapper m = mapper.withTransaction(tx);
      Item i = m.getById(Item.withId(id));
      i.price = 12;
      m.save(i);
      m.update(Item.withId(id), List.of(FieldUpdate.of("name", "Gizmo")));
      assertEquals(10.0, store.raw("items", id).get("price"));
      return null;
    });

    Map<String, Object> raw = store.raw("items", id);
    assertEquals(12.0, raw.get("price"));
    assertEquals("Gizmo", raw.get("name"));
    assertEquals(writes, store.directWrites());
    assertFalse(mapper.session().hasTransaction());
  }

  @Test
  void registeredAdapterAndCustomCollection() {
    Gadget g = new Gadget();
    g.setSerial("sn-9");
    g.setLabel("probe");
    g.setWeight(40);
    mapper.save(g);
    assertEquals(Map.of("label", "probe", "weight_g", 40), store.raw("gadgets", "sn-9"));

    Invoice inv = new Invoice();
    inv.tenant = "globex";
    inv.total = 500;
    mapper.save(inv);
    assertEquals(1, store.count("globex_invoices"));
    assertEquals(inv.id, mapper.idOf(inv));
  }
}
