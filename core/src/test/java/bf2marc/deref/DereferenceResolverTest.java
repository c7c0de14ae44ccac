package bf2marc.deref;

import bf2marc.ConversionMetrics;
import bf2marc.ConversionProfile;
import bf2marc.Description;
import bf2marc.TestData;
import bf2marc.component.GraphStore;
import bf2marc.converter.StripedXmlConverter;
import bf2marc.exception.DereferenceException;
import bf2marc.extract.DescriptionExtractor;
import bf2marc.util.Xml;
import org.apache.jena.rdf.model.Model;
import org.apache.jena.rdf.model.ModelFactory;
import org.apache.jena.vocabulary.RDFS;
import org.junit.Assert;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

public class DereferenceResolverTest
{
    private static final String WORK = "http://id.loc.gov/ontologies/bibframe/Work";
    private static final String SUBJECTS = "http://id.loc.gov/authorities/subjects/";

    /**
     * Answers every IRI with a label, or fails for IRIs containing "broken".
     */
    private static class FakeDereferencer implements Dereferencer
    {
        final List<String> requested = new ArrayList<>();

        @Override
        public synchronized Model fetch(String iri) throws DereferenceException
        {
            requested.add(iri);
            if (iri.contains("broken"))
                throw new DereferenceException("no such resource");
            Model model = ModelFactory.createDefaultModel();
            model.add(model.createResource(iri), RDFS.label, "label of " + iri);
            return model;
        }
    }

    private static Description describe(String turtle) throws Exception
    {
        GraphStore store = TestData.storeFromTurtle(turtle);
        return new DescriptionExtractor(
                "PREFIX bf: <http://id.loc.gov/ontologies/bibframe/>\n" +
                "SELECT ?work ?instance WHERE { ?work bf:hasInstance ?instance }", 3)
                .extract(store.getModel()).get(0);
    }

    private static DereferenceConfig subjectsOfWorks()
    {
        return DereferenceConfig.of(Collections.singletonMap(WORK, Collections.singletonList(SUBJECTS)));
    }

    @Test
    public void testMatchingObjectsAreFetched() throws Exception
    {
        Description d = describe(
                "ex:w a bf:Work ; bf:hasInstance ex:i ;\n" +
                "  bf:subject <http://id.loc.gov/authorities/subjects/sh1> ;\n" +
                "  bf:genreForm <http://id.loc.gov/authorities/genreForms/gf1> .\n" +
                "ex:i a bf:Instance ; bf:subject <http://id.loc.gov/authorities/subjects/sh2> .\n");
        FakeDereferencer fake = new FakeDereferencer();

        Model resolved = new DereferenceResolver(fake).resolve(d, subjectsOfWorks());

        // Prefix does not match, and the instance is not of the configured class
        Assert.assertEquals(Collections.singletonList(SUBJECTS + "sh1"), fake.requested);
        Assert.assertTrue(resolved.contains(resolved.createResource(SUBJECTS + "sh1"), RDFS.label));
        Assert.assertEquals(d.getModel().size() + 1, resolved.size());
    }

    @Test
    public void testDescriptionIsNotTouched() throws Exception
    {
        Description d = describe(
                "ex:w a bf:Work ; bf:hasInstance ex:i ; bf:subject <http://id.loc.gov/authorities/subjects/sh1> .\n" +
                "ex:i a bf:Instance .\n");
        long before = d.getModel().size();

        Model resolved = new DereferenceResolver(new FakeDereferencer()).resolve(d, subjectsOfWorks());

        Assert.assertNotSame(d.getModel(), resolved);
        Assert.assertEquals(before, d.getModel().size());
        Assert.assertFalse(d.getModel().contains(null, RDFS.label));
    }

    @Test
    public void testOtherDescriptionsStripeTheSame() throws Exception
    {
        GraphStore store = TestData.storeFromResource("bf2marc/descriptions.ttl");
        List<Description> descriptions = DescriptionExtractor.fromProfile(new ConversionProfile()).extract(store.getModel());
        Description first = null;
        Description second = null;
        for (Description d : descriptions)
        {
            if (d.getWork().getURI().equals(TestData.EX + "work1"))
                first = d;
            else if (d.getWork().getURI().equals(TestData.EX + "work2"))
                second = d;
        }
        StripedXmlConverter striper = new StripedXmlConverter();
        String before = Xml.docToString(striper.stripe(second, second.getModel()));

        Model resolved = new DereferenceResolver(new FakeDereferencer()).resolve(first, subjectsOfWorks());
        Assert.assertTrue(resolved.size() > first.getModel().size());
        Xml.docToString(striper.stripe(first, resolved));

        Assert.assertEquals(before, Xml.docToString(striper.stripe(second, second.getModel())));
    }

    @Test
    public void testEachIriFetchedOnce() throws Exception
    {
        Description d = describe(
                "ex:w a bf:Work ; bf:hasInstance ex:i ;\n" +
                "  bf:subject <http://id.loc.gov/authorities/subjects/sh1> ;\n" +
                "  bf:genreForm <http://id.loc.gov/authorities/subjects/sh1> .\n" +
                "ex:i a bf:Instance ; bf:instanceOf ex:w2 .\n" +
                "ex:w2 a bf:Work ; bf:subject <http://id.loc.gov/authorities/subjects/sh1> .\n");
        FakeDereferencer fake = new FakeDereferencer();

        new DereferenceResolver(fake).resolve(d, subjectsOfWorks());
        Assert.assertEquals(1, fake.requested.size());
    }

    @Test
    public void testFailureIsNotFatal() throws Exception
    {
        Description d = describe(
                "ex:w a bf:Work ; bf:hasInstance ex:i ;\n" +
                "  bf:subject <http://id.loc.gov/authorities/subjects/broken> ;\n" +
                "  bf:subject <http://id.loc.gov/authorities/subjects/sh1> .\n" +
                "ex:i a bf:Instance .\n");
        ConversionMetrics metrics = new ConversionMetrics();

        Model resolved = new DereferenceResolver(new FakeDereferencer(), metrics).resolve(d, subjectsOfWorks());

        Assert.assertTrue(resolved.contains(resolved.createResource(SUBJECTS + "sh1"), RDFS.label));
        Assert.assertEquals(1, metrics.getDereferences(true));
        Assert.assertEquals(1, metrics.getDereferences(false));
    }

    @Test
    public void testEmptyConfigIsIdentity() throws Exception
    {
        Description d = describe(
                "ex:w a bf:Work ; bf:hasInstance ex:i ; bf:subject <http://id.loc.gov/authorities/subjects/sh1> .\n" +
                "ex:i a bf:Instance .\n");
        FakeDereferencer fake = new FakeDereferencer();

        Assert.assertSame(d.getModel(), new DereferenceResolver(fake).resolve(d, DereferenceConfig.empty()));
        Assert.assertTrue(fake.requested.isEmpty());
    }

    @Test
    public void testLiteralsAndBlankNodesAreNeverTargets() throws Exception
    {
        Description d = describe(
                "ex:w a bf:Work ; bf:hasInstance ex:i ;\n" +
                "  rdfs:label \"http://id.loc.gov/authorities/subjects/sh1\" ;\n" +
                "  bf:subject [ a bf:Topic ] .\n" +
                "ex:i a bf:Instance .\n");
        Set<String> targets = new DereferenceResolver(new FakeDereferencer())
                .findTargets(d.getModel(), subjectsOfWorks());
        Assert.assertTrue(targets.isEmpty());
    }
}
