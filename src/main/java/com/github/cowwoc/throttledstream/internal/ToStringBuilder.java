package com.github.cowwoc.throttledstream.internal;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.StringJoiner;

import static com.github.cowwoc.requirements.DefaultRequirements.requireThat;

/**
 * Standardizes the format of toString() return values.
 */
public final class ToStringBuilder
{
	private final String name;
	private final List<String> keys = new ArrayList<>();
	private final List<String> values = new ArrayList<>();

	/**
	 * Creates a new builder.
	 *
	 * @param aClass the type of object being processed
	 * @throws NullPointerException if {@code aClass} is null
	 */
	public ToStringBuilder(Class<?> aClass)
	{
		requireThat(aClass, "aClass").isNotNull();
		this.name = getName(aClass);
	}

	/**
	 * @param aClass a class
	 * @return the simple name of the class, prefixed by the simple names of its enclosing classes
	 */
	private static String getName(Class<?> aClass)
	{
		StringBuilder result = new StringBuilder(aClass.getSimpleName());
		for (Class<?> current = aClass.getEnclosingClass(); current != null;
		     current = current.getEnclosingClass())
		{
			result.insert(0, '.').insert(0, current.getSimpleName());
		}
		return result.toString();
	}

	/**
	 * Adds a property.
	 *
	 * @param name  the name of the property
	 * @param value the value of the property
	 * @return this
	 * @throws NullPointerException     if {@code name} is null
	 * @throws IllegalArgumentException if {@code name} is blank
	 */
	public ToStringBuilder add(String name, Object value)
	{
		requireThat(name, "name").isNotBlank();
		keys.add(name);
		if (value instanceof Collection<?> collection)
		{
			StringJoiner joiner = new StringJoiner(", ", "[", "]");
			for (Object element : collection)
				joiner.add(String.valueOf(element));
			values.add(joiner.toString());
		}
		else
			values.add(String.valueOf(value));
		return this;
	}

	@Override
	public String toString()
	{
		int width = 0;
		for (String key : keys)
			width = Math.max(width, key.length());

		StringJoiner body = new StringJoiner(",\n\t", "\t", "\n");
		for (int i = 0; i < keys.size(); ++i)
		{
			String key = keys.get(i);
			String value = values.get(i).replace("\n", "\n\t");
			body.add(key + " ".repeat(width - key.length()) + ": " + value);
		}
		return name + "\n{\n" + body + "}";
	}
}
