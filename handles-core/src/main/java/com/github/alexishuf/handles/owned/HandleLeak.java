package com.github.alexishuf.handles.owned;

import jdk.jfr.*;

@Enabled
@Name("com.github.alexishuf.handles.owned.Leak")
@Label("Handle leak")
@Description("An ExclusiveOwner or SharedOwner became eligible for collection by the GC " +
             "while still holding a value")
@Registered
@StackTrace(false) // trace from the Cleaner thread is not helpful
@Category({"Handles", "Owned"})
public class HandleLeak extends Event {
    @Label("handleName")
    @Description("SimpleClassName@identityHashCode of the leaked handle")
    public String handleName;

    @Label("valueClassName")
    @Description("The getClass().getName() of the value held by the leaked handle")
    public String valueClassName;
}
