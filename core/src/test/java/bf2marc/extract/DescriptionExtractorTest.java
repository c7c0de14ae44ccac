package bf2marc.extract;

import bf2marc.ConversionProfile;
import bf2marc.Description;
import bf2marc.TestData;
import bf2marc.component.GraphStore;
import bf2marc.exception.ConfigurationException;
import bf2marc.exception.ExtractionException;
import bf2marc.meta.Bibframe;
import org.apache.jena.rdf.model.Resource;
import org.apache.jena.rdf.model.ResourceFactory;
import org.apache.jena.vocabulary.RDFS;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;

public class DescriptionExtractorTest
{
    private DescriptionExtractor extractor;

    @Before
    public void setUp() throws Exception
    {
        extractor = DescriptionExtractor.fromProfile(new ConversionProfile());
    }

    private static List<String> works(List<Description> descriptions)
    {
        List<String> result = new ArrayList<>();
        for (Description d : descriptions)
            result.add(d.getWork().getURI());
        return result;
    }

    @Test
    public void testOnePerPairAndNoOrphans() throws Exception
    {
        GraphStore store = TestData.storeFromResource("bf2marc/descriptions.ttl");
        List<Description> descriptions = extractor.extract(store.getModel());

        Assert.assertEquals(3, descriptions.size());
        List<String> works = works(descriptions);
        Assert.assertTrue(works.contains(TestData.EX + "work1"));
        Assert.assertTrue(works.contains(TestData.EX + "work2"));
        Assert.assertTrue(works.contains(TestData.EX + "work3"));
        Assert.assertFalse(works.contains(TestData.EX + "work5"));
        for (Description d : descriptions)
            Assert.assertNotEquals(TestData.EX + "instance4", d.getInstance().getURI());
    }

    @Test
    public void testClosure() throws Exception
    {
        GraphStore store = TestData.storeFromResource("bf2marc/descriptions.ttl");
        Description d1 = null;
        for (Description d : extractor.extract(store.getModel()))
        {
            if (d.getWork().getURI().equals(TestData.EX + "work1"))
                d1 = d;
        }
        Assert.assertNotNull(d1);

        // Nested blank nodes come along
        Assert.assertTrue(d1.getModel().contains(null, RDFS.label, "Strindberg, August"));
        Assert.assertTrue(d1.getModel().contains(null, RDFS.label, "Stockholm"));

        // So does the item pointing at the instance
        Assert.assertEquals(1, d1.getItems().size());
        Assert.assertEquals(TestData.EX + "item1", d1.getItems().get(0).getURI());
        Assert.assertTrue(d1.getModel().contains(null, RDFS.label, "KB"));

        // But nothing from the other descriptions
        Assert.assertFalse(d1.getModel().contains(ResourceFactory.createResource(TestData.EX + "instance2"), null));
        Assert.assertFalse(d1.getModel().contains(null, ResourceFactory.createProperty(Bibframe.NS, "mainTitle"), "Hemsöborna"));
    }

    @Test
    public void testDescriptionsDoNotShareTriples() throws Exception
    {
        GraphStore store = TestData.storeFromResource("bf2marc/descriptions.ttl");
        List<Description> descriptions = extractor.extract(store.getModel());
        Resource work2 = ResourceFactory.createResource(TestData.EX + "work2");
        long before = store.size();

        descriptions.get(0).getModel().add(work2, RDFS.label, "changed");
        for (Description d : descriptions.subList(1, descriptions.size()))
            Assert.assertFalse(d.getModel().contains(work2, RDFS.label));
        Assert.assertEquals(before, store.size());
    }

    @Test
    public void testDuplicatePairsCollapse() throws Exception
    {
        GraphStore store = TestData.storeFromTurtle(
                "ex:w a bf:Work ; bf:hasInstance ex:i .\n" +
                "ex:i a bf:Instance ; bf:instanceOf ex:w .\n");
        Assert.assertEquals(1, extractor.extract(store.getModel()).size());
    }

    @Test
    public void testOneWorkManyInstances() throws Exception
    {
        GraphStore store = TestData.storeFromTurtle(
                "ex:w a bf:Work ; bf:hasInstance ex:i1, ex:i2 .\n" +
                "ex:i1 a bf:Instance .\n" +
                "ex:i2 a bf:Instance .\n");
        Assert.assertEquals(2, extractor.extract(store.getModel()).size());
    }

    @Test
    public void testBlankNodeWork() throws Exception
    {
        GraphStore store = TestData.storeFromTurtle(
                "ex:i a bf:Instance ; bf:instanceOf [ a bf:Work ; rdfs:label \"anonymous\" ] .\n");
        List<Description> descriptions = extractor.extract(store.getModel());
        Assert.assertEquals(1, descriptions.size());
        Description d = descriptions.get(0);
        Assert.assertTrue(d.getWork().isAnon());
        Assert.assertTrue(d.getModel().contains(d.getWork(), RDFS.label, "anonymous"));
        Assert.assertTrue(d.getLabel().contains("_:"));
    }

    @Test
    public void testNamedResourcesStopAtDepth() throws Exception
    {
        GraphStore store = TestData.storeFromTurtle(
                "ex:w a bf:Work ; bf:hasInstance ex:i ; ex:p ex:a .\n" +
                "ex:i a bf:Instance .\n" +
                "ex:a ex:p ex:b .\n" +
                "ex:b ex:p ex:c .\n" +
                "ex:c rdfs:label \"far away\" .\n");

        List<Description> shallow = new DescriptionExtractor(
                DescriptionExtractor.loadQueryText("bf2marc/select-descriptions.rq"), 1).extract(store.getModel());
        Resource a = ResourceFactory.createResource(TestData.EX + "a");
        Resource b = ResourceFactory.createResource(TestData.EX + "b");
        Assert.assertTrue(shallow.get(0).getModel().contains(a, null));
        Assert.assertFalse(shallow.get(0).getModel().contains(b, null));

        List<Description> deep = extractor.extract(store.getModel());
        Assert.assertTrue(deep.get(0).getModel().contains(null, RDFS.label, "far away"));
    }

    @Test
    public void testBlankNodePathShortensNamedDistance() throws Exception
    {
        GraphStore store = TestData.storeFromTurtle(
                "ex:w a bf:Work ; bf:hasInstance ex:i ; ex:p ex:a ; ex:q _:b1 .\n" +
                "ex:i a bf:Instance .\n" +
                "ex:a ex:p ex:y .\n" +
                "_:b1 ex:q _:b2 .\n" +
                "_:b2 ex:q ex:y .\n" +
                "ex:y ex:p ex:z .\n" +
                "ex:z rdfs:label \"two hops\" .\n");

        // ex:y is one named hop away through the blank nodes, so ex:z is two
        List<Description> descriptions = new DescriptionExtractor(
                DescriptionExtractor.loadQueryText("bf2marc/select-descriptions.rq"), 2).extract(store.getModel());
        Assert.assertTrue(descriptions.get(0).getModel().contains(null, RDFS.label, "two hops"));
    }

    @Test
    public void testUntypedPairsAreSkipped() throws Exception
    {
        GraphStore store = TestData.storeFromTurtle(
                "ex:w1 bf:hasInstance ex:i1 .\n" +
                "ex:i1 a bf:Instance .\n" +
                "ex:w2 a bf:Work .\n" +
                "ex:i2 bf:instanceOf ex:w2 .\n" +
                "ex:w3 a bf:Work ; bf:hasInstance ex:i3 .\n" +
                "ex:i3 a bf:Item .\n");
        Assert.assertTrue(extractor.extract(store.getModel()).isEmpty());
    }

    @Test
    public void testSubclassTypesCount() throws Exception
    {
        GraphStore store = TestData.storeFromTurtle(
                "bf:Text rdfs:subClassOf bf:Work .\n" +
                "bf:Print rdfs:subClassOf bf:Instance .\n" +
                "ex:w a bf:Text ; bf:hasInstance ex:i .\n" +
                "ex:i a bf:Print, bf:Monograph .\n");
        List<Description> descriptions = extractor.extract(store.getModel());
        Assert.assertEquals(1, descriptions.size());
        Assert.assertEquals(TestData.EX + "w", descriptions.get(0).getWork().getURI());
    }

    @Test
    public void testCyclesTerminate() throws Exception
    {
        GraphStore store = TestData.storeFromTurtle(
                "ex:w a bf:Work ; bf:hasInstance ex:i ; ex:p _:x .\n" +
                "_:x ex:p _:y .\n" +
                "_:y ex:p _:x .\n" +
                "ex:i a bf:Instance .\n");
        List<Description> descriptions = extractor.extract(store.getModel());
        Assert.assertEquals(1, descriptions.size());
        Assert.assertEquals(6, descriptions.get(0).getModel().size());
    }

    @Test
    public void testEmptyGraph() throws Exception
    {
        Assert.assertTrue(extractor.extract(new GraphStore().getModel()).isEmpty());
    }

    @Test(expected = ExtractionException.class)
    public void testMalformedQuery() throws Exception
    {
        new DescriptionExtractor("SELECT ?work ?instance WHERE {", 3);
    }

    @Test(expected = ExtractionException.class)
    public void testQueryMustProjectBothRoots() throws Exception
    {
        new DescriptionExtractor("SELECT ?work WHERE { ?work a <http://id.loc.gov/ontologies/bibframe/Work> }", 3);
    }

    @Test(expected = ConfigurationException.class)
    public void testMissingQuery() throws Exception
    {
        DescriptionExtractor.loadQueryText("no/such/query.rq");
    }
}
