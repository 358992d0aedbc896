package regmap.bus;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import regmap.address.Direction;
import regmap.behavior.ControlBehavior;
import regmap.behavior.ExternalBehavior;
import regmap.behavior.StatusBehavior;
import regmap.behavior.StrobeBehavior;
import regmap.config.ConstantConfig;
import regmap.config.ControlConfig;
import regmap.config.ExternalConfig;
import regmap.config.FieldConfig;
import regmap.config.PermissionConfig;
import regmap.config.RegisterFileConfig;
import regmap.config.StatusConfig;
import regmap.config.StrobeConfig;
import regmap.drc.RegmapException;
import regmap.model.Endianness;
import regmap.model.RegisterFile;
import regmap.model.RegisterFileBuilder;

class BusSimulatorTest {

  private static RegisterFile compile(RegisterFileConfig.Builder config, FieldConfig.Builder... fields) throws RegmapException {
    for (FieldConfig.Builder field : fields)
      config.addField(field.build());
    return new RegisterFileBuilder().build(config.build());
  }

  private static RegisterFile compile(FieldConfig.Builder... fields) throws RegmapException {
    return compile(RegisterFileConfig.builder("rf"), fields);
  }

  @SuppressWarnings("unchecked")
  private static <T> T behavior(RegisterFile rf, String field) {
    return (T)rf.getField(field).getBehavior();
  }

  @Test
  void testDeferredReadsCompleteInOrder() throws RegmapException {
    RegisterFile rf = compile(FieldConfig.builder("fifo", 0x10, new ExternalConfig(true, false, true)));
    ExternalBehavior fifo = behavior(rf, "fifo");
    BusSimulator sim = new BusSimulator(rf);
    Transaction a = sim.submitRead(0x10, 0);
    Transaction b = sim.submitRead(0x10, 0);
    Transaction c = sim.submitRead(0x10, 0);
    for (int i = 0; i < 4; ++i)
      sim.cycle();
    Assertions.assertEquals(3, sim.getDeferredCount(Direction.READ));
    Assertions.assertEquals(3, fifo.getPendingRequestCount());
    Assertions.assertFalse(a.isDone());

    fifo.respondRead(10);
    fifo.respondRead(20);
    fifo.respondRead(30);
    sim.runUntilDone(c);
    Assertions.assertEquals(10, a.getReadData());
    Assertions.assertEquals(20, b.getReadData());
    Assertions.assertEquals(30, c.getReadData());
    Assertions.assertEquals(BusResponse.OKAY, b.getResponse());
    Assertions.assertTrue(a.getCompleteCycle() < b.getCompleteCycle());
    Assertions.assertTrue(b.getCompleteCycle() < c.getCompleteCycle());
    Assertions.assertEquals(0, sim.getDeferredCount(Direction.READ));
    Assertions.assertTrue(sim.isIdle());
  }

  @Test
  void testDeferredWrites() throws RegmapException {
    RegisterFile rf = compile(FieldConfig.builder("sink", 0x20, new ExternalConfig(false, true, true)).setBitrange(15, 0));
    ExternalBehavior sink = behavior(rf, "sink");
    BusSimulator sim = new BusSimulator(rf);
    Transaction first = sim.submitWrite(0x20, 0x1234, 0);
    Transaction second = sim.submitWrite(0x20, 0xABCD, 0b01, 0);
    sim.cycle();
    sim.cycle();
    Assertions.assertEquals(2, sim.getDeferredCount(Direction.WRITE));
    Assertions.assertEquals(0x1234, sink.takeRequest().data());
    ExternalBehavior.Request request = sink.takeRequest();
    // only the strobed byte reaches the field
    Assertions.assertEquals(0xCD, request.data());
    Assertions.assertEquals(0x00FF, request.strobe());

    sink.respondWrite();
    sink.respondError(Direction.WRITE);
    sim.runUntilDone(second);
    Assertions.assertEquals(BusResponse.OKAY, first.getResponse());
    Assertions.assertEquals(BusResponse.SLAVE_ERROR, second.getResponse());
  }

  @Test
  void testLittleEndianWriteIsAtomic() throws RegmapException {
    RegisterFile rf = compile(FieldConfig.builder("ctl", 0, new ControlConfig()).setBitrange(63, 0));
    ControlBehavior ctl = behavior(rf, "ctl");
    BusSimulator sim = new BusSimulator(rf);
    Assertions.assertEquals(BusResponse.OKAY, sim.write(0x0, 0x11111111L));
    Assertions.assertEquals(0, ctl.getValue());
    Assertions.assertEquals(0, ctl.getWriteCount());
    Assertions.assertEquals(BusResponse.OKAY, sim.write(0x4, 0x22222222L));
    Assertions.assertEquals(0x2222222211111111L, ctl.getValue());
    Assertions.assertEquals(1, ctl.getWriteCount());

    // staged data does not leak into the next write
    sim.write(0x4, 0x33333333L);
    Assertions.assertEquals(0x3333333311111111L, ctl.getValue());
  }

  @Test
  void testBigEndianWrite() throws RegmapException {
    RegisterFile rf = compile(RegisterFileConfig.builder("rf").setEndianness(Endianness.BIG),
                              FieldConfig.builder("ctl", 0, new ControlConfig()).setBitrange(63, 0));
    ControlBehavior ctl = behavior(rf, "ctl");
    BusSimulator sim = new BusSimulator(rf);
    sim.write(0x0, 0xAAAAAAAAL);
    Assertions.assertEquals(0, ctl.getValue());
    sim.write(0x4, 0x55555555L);
    Assertions.assertEquals(0xAAAAAAAA55555555L, ctl.getValue());
    Assertions.assertEquals(0xAAAAAAAAL, sim.read(0x0).data());
    Assertions.assertEquals(0x55555555L, sim.read(0x4).data());
  }

  @Test
  void testReadSnapshot() throws RegmapException {
    RegisterFile rf = compile(FieldConfig.builder("counter", 0x8, new StatusConfig()).setBitrange(63, 0));
    StatusBehavior counter = behavior(rf, "counter");
    BusSimulator sim = new BusSimulator(rf);
    counter.setValue(0x1122334455667788L);
    Assertions.assertEquals(0x55667788L, sim.read(0x8).data());
    // the high word comes from the snapshot, not from the live value
    counter.setValue(0);
    Assertions.assertEquals(0x11223344L, sim.read(0xC).data());
    BusSimulator.ReadResult again = sim.read(0xC);
    Assertions.assertEquals(BusResponse.SLAVE_ERROR, again.response());
    Assertions.assertFalse(again.isOkay());
  }

  @Test
  void testFailedFirstWordDropsSnapshot() throws RegmapException {
    RegisterFile rf = compile(FieldConfig.builder("ext", 0x10, new ExternalConfig(true, false, false)).setBitrange(63, 0));
    ExternalBehavior ext = behavior(rf, "ext");
    BusSimulator sim = new BusSimulator(rf);
    ext.respondRead(0x1122334455667788L);
    Assertions.assertEquals(0x55667788L, sim.read(0x10).data());
    ext.respondError(Direction.READ);
    Assertions.assertEquals(BusResponse.SLAVE_ERROR, sim.read(0x10).response());
    Assertions.assertEquals(BusResponse.SLAVE_ERROR, sim.read(0x14).response());
  }

  @Test
  void testSixtyFourBitBus() throws RegmapException {
    RegisterFile rf = compile(RegisterFileConfig.builder("rf").setBusWidth(64),
                              FieldConfig.builder("counter", 0x8, new StatusConfig()).setBitrange(63, 0));
    StatusBehavior counter = behavior(rf, "counter");
    BusSimulator sim = new BusSimulator(rf);
    counter.setValue(0x1122334455667788L);
    Assertions.assertEquals(0x1122334455667788L, sim.read(0x8).data());
    Assertions.assertEquals(0x1122334455667788L, sim.read(0xC).data());
  }

  @Test
  void testRepeatedStatusFields() throws RegmapException {
    RegisterFile rf = compile(FieldConfig.builder("lane", 0, new StatusConfig()).setBitrange(7, 0).setRepeat(4));
    long[] values = {0x04, 0x08, 0x0F, 0x10};
    for (int i = 0; i < 4; ++i)
      ((StatusBehavior)behavior(rf, "lane" + i)).setValue(values[i]);
    BusSimulator sim = new BusSimulator(rf);
    Assertions.assertEquals(new BusSimulator.ReadResult(BusResponse.OKAY, 0x100F0804L), sim.read(0));
    Assertions.assertEquals(BusResponse.DECODE_ERROR, sim.read(4).response());

    rf = compile(FieldConfig.builder("lane", 0, new StatusConfig()).setBitrange(31, 24).setRepeat(4).setFieldStride(-8));
    for (int i = 0; i < 4; ++i)
      ((StatusBehavior)behavior(rf, "lane" + i)).setValue(values[i]);
    Assertions.assertEquals(0x04080F10L, new BusSimulator(rf).read(0).data());
  }

  @Test
  void testByteStrobes() throws RegmapException {
    RegisterFile rf = compile(FieldConfig.builder("ctl", 0, new ControlConfig()), FieldConfig.builder("kick", 4, new StrobeConfig()).setBitrange(7, 0));
    ControlBehavior ctl = behavior(rf, "ctl");
    StrobeBehavior kick = behavior(rf, "kick");
    BusSimulator sim = new BusSimulator(rf);
    Assertions.assertEquals(BusResponse.OKAY, sim.write(0, 0xAABBCCDDL, 0b0101, 0));
    Assertions.assertEquals(0x00BB00DDL, ctl.getValue());
    sim.write(4, 0x81);
    Assertions.assertEquals(0x81, kick.takeAccumulated());
    // strobe fields are write-only
    Assertions.assertEquals(BusResponse.DECODE_ERROR, sim.read(4).response());
  }

  @Test
  void testDecodeErrors() throws RegmapException {
    RegisterFile rf = compile(FieldConfig.builder("version", 0, new ConstantConfig(0x12)));
    BusSimulator sim = new BusSimulator(rf);
    Assertions.assertEquals(new BusSimulator.ReadResult(BusResponse.OKAY, 0x12), sim.read(0));
    Assertions.assertEquals(BusResponse.DECODE_ERROR, sim.read(0x100).response());
    Assertions.assertEquals(BusResponse.DECODE_ERROR, sim.write(0, 1));
  }

  @Test
  void testPermissions() throws RegmapException {
    PermissionConfig privilegedOnly = new PermissionConfig(false, true, true, true, true, true);
    RegisterFile rf = compile(FieldConfig.builder("secret", 0, new ControlConfig(0x5A)).setBitrange(7, 0).setPermissions(privilegedOnly),
                              FieldConfig.builder("open", 0, new ControlConfig(0x01)).setBitrange(15, 8));
    BusSimulator sim = new BusSimulator(rf);
    Assertions.assertEquals(0x15AL, sim.read(0, 0b001).data());
    // the secret field is absent for unprivileged accesses
    Assertions.assertEquals(0x100L, sim.read(0, 0b000).data());
    sim.write(0, 0xFFFF, 0b11, 0b000);
    Assertions.assertEquals(0x5A, ((ControlBehavior)behavior(rf, "secret")).getValue());
    Assertions.assertEquals(0xFF, ((ControlBehavior)behavior(rf, "open")).getValue());

    RegisterFile hidden = compile(FieldConfig.builder("secret", 0, new ControlConfig()).setPermissions(privilegedOnly));
    Assertions.assertEquals(BusResponse.DECODE_ERROR, new BusSimulator(hidden).read(0, 0b000).response());
  }

  @Test
  void testBlockingExternal() throws RegmapException {
    RegisterFile rf = compile(FieldConfig.builder("ext", 0x10, new ExternalConfig(true, true, false)));
    ExternalBehavior ext = behavior(rf, "ext");
    BusSimulator sim = new BusSimulator(rf);
    Transaction txn = sim.submitRead(0x10, 0);
    for (int i = 0; i < 5; ++i)
      sim.cycle();
    Assertions.assertFalse(txn.isDone());
    Assertions.assertEquals(1, ext.getPendingRequestCount());
    Assertions.assertEquals(0x10, ext.takeRequest().address());
    ext.respondRead(0xCAFE);
    sim.runUntilDone(txn);
    Assertions.assertEquals(0xCAFE, txn.getReadData());

    txn = sim.submitWrite(0x10, 7, 0);
    sim.cycle();
    ext.respondError(Direction.WRITE);
    sim.runUntilDone(txn);
    Assertions.assertEquals(BusResponse.SLAVE_ERROR, txn.getResponse());

    sim.setMaxCycles(10);
    Transaction stuck = sim.submitRead(0x10, 0);
    Assertions.assertThrows(IllegalStateException.class, () -> sim.runUntilDone(stuck));
  }

  @Test
  void testBackpressure() throws RegmapException {
    RegisterFile rf = compile(FieldConfig.builder("a", 0, new ConstantConfig(1)), FieldConfig.builder("b", 4, new ConstantConfig(2)));
    BusSimulator sim = new BusSimulator(rf);
    sim.setResponseReady(Direction.READ, false);
    Transaction first = sim.submitRead(0, 0);
    Transaction second = sim.submitRead(4, 0);
    for (int i = 0; i < 3; ++i)
      sim.cycle();
    Assertions.assertFalse(first.isDone());
    Assertions.assertFalse(sim.isIdle());
    sim.setResponseReady(Direction.READ, true);
    sim.runUntilDone(second);
    Assertions.assertEquals(1, first.getReadData());
    Assertions.assertEquals(2, second.getReadData());
    Assertions.assertTrue(first.getCompleteCycle() < second.getCompleteCycle());
  }
}
